package com.github.odeint.calculus.exceptions;

public class DimensionMismatchException extends RuntimeException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual, double t) {
        super(String.format(
                "Derivative function returned %d components for a state of dimension %d (t = %s)",
                actual, expected, t));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
