package com.example.arithmetic;

public class FactorialOverflowException extends ArithmeticException {
    private static final long serialVersionUID = 1L;

    private final int input;
    private final int maxInput;

    public FactorialOverflowException(int input, int maxInput) {
        super("n must be " + maxInput + " or less to avoid long overflow, got " + input);
        this.input = input;
        this.maxInput = maxInput;
    }

    public int getInput() {
        return input;
    }

    public int getMaxInput() {
        return maxInput;
    }
}
