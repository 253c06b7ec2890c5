package com.example.arithmetic;

import java.util.stream.LongStream;

public final class Factorial {
    public static final int MAX_INPUT = 20;

    static final String NEGATIVE_INPUT_MESSAGE = "Il fattoriale non è definito per numeri negativi.";

    private Factorial() {}

    public static long factorial(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative");
        }
        if (n > MAX_INPUT) {
            throw new FactorialOverflowException(n, MAX_INPUT);
        }
        return LongStream.rangeClosed(1, n).reduce(1L, (acc, i) -> acc * i);
    }

    public static String describe(int n) {
        if (n < 0) {
            return NEGATIVE_INPUT_MESSAGE;
        }
        return String.format("Il fattoriale di %d è %d.", n, factorial(n));
    }
}
