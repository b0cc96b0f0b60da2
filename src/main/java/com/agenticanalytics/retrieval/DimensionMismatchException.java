package com.agenticanalytics.retrieval;

public class DimensionMismatchException extends RetrievalException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
