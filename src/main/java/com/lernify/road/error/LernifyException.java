package com.lernify.road.error;

/**
 * Base of every failure the service reports to its callers. The {@link ErrorKind} is stable
 * and is what the HTTP layer maps to a status code; the message is human readable detail.
 */
public class LernifyException extends RuntimeException {
    private final ErrorKind kind;

    public LernifyException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
