package com.lernify.road.error;

public class UnauthorizedException extends LernifyException {
    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
