package com.lernify.road.error;

public class ConflictException extends LernifyException {
    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
