package com.example.arithmetic;

public final class Addition {
    private Addition() {}

    /**
     * Adds two ints with Java's wrapping semantics. Results are exact only while
     * the true sum stays within {@link Integer#MIN_VALUE}..{@link Integer#MAX_VALUE};
     * outside that domain the value wraps and no error is raised.
     */
    public static int add(int a, int b) {
        return a + b;
    }

    public static String describe(int a, int b) {
        return String.format("La somma di %d e %d è: %d", a, b, add(a, b));
    }
}
