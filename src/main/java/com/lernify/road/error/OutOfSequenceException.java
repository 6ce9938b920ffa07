package com.lernify.road.error;

public class OutOfSequenceException extends LernifyException {
    private final int completed;
    private final int requested;

    public OutOfSequenceException(String domain, int completed, int requested) {
        super(ErrorKind.OUT_OF_SEQUENCE,
                "You must complete previous step first: domain=" + domain + ", completed=" + completed + ", requested=" + requested);
        this.completed = completed;
        this.requested = requested;
    }

    public int completed() {
        return completed;
    }

    public int requested() {
        return requested;
    }
}
