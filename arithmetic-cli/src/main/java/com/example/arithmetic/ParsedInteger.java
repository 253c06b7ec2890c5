package com.example.arithmetic;

import java.util.Objects;

public final class ParsedInteger {
    private final int value;
    private final InputParseError error;

    private ParsedInteger(int value, InputParseError error) {
        this.value = value;
        this.error = error;
    }

    public static ParsedInteger of(int value) {
        return new ParsedInteger(value, null);
    }

    public static ParsedInteger failed(InputParseError error) {
        return new ParsedInteger(0, Objects.requireNonNull(error, "error"));
    }

    public boolean isValid() {
        return error == null;
    }

    public int value() {
        if (error != null) {
            throw new IllegalStateException("no value: " + error.getMessage());
        }
        return value;
    }

    public InputParseError error() {
        if (error == null) {
            throw new IllegalStateException("no error: parsed " + value);
        }
        return error;
    }

    @Override
    public String toString() {
        return isValid() ? "ParsedInteger[" + value + "]" : "ParsedInteger[" + error + "]";
    }
}
