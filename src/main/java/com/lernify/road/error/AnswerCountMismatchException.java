package com.lernify.road.error;

public class AnswerCountMismatchException extends LernifyException {
    private final int expected;
    private final int actual;

    public AnswerCountMismatchException(int expected, int actual) {
        super(ErrorKind.ANSWER_COUNT_MISMATCH, "Answer count mismatch: expected " + expected + ", got " + actual);
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
