package com.example.arithmetic;

import java.util.Objects;

public final class InputParseError {
    private final String input;
    private final String reason;

    public InputParseError(String input, String reason) {
        this.input = input;
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public String getInput() {
        return input;
    }

    public String getReason() {
        return reason;
    }

    public String getMessage() {
        if (input == null) {
            return "Input non valido: " + reason + ".";
        }
        return "Input non valido: \"" + input + "\" (" + reason + ").";
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
