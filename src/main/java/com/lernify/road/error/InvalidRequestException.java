package com.lernify.road.error;

public class InvalidRequestException extends LernifyException {
    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
