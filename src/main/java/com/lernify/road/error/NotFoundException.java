package com.lernify.road.error;

public class NotFoundException extends LernifyException {
    private NotFoundException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public static NotFoundException domain(String domain) {
        return new NotFoundException(ErrorKind.DOMAIN_NOT_FOUND, "Domain not found: " + domain);
    }

    public static NotFoundException step(String domain, int stepIndex) {
        return new NotFoundException(ErrorKind.STEP_NOT_FOUND, "Step " + stepIndex + " not found in domain: " + domain);
    }
}
