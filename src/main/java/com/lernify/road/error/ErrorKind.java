package com.lernify.road.error;

public enum ErrorKind {
    DOMAIN_NOT_FOUND,
    STEP_NOT_FOUND,
    OUT_OF_SEQUENCE,
    ANSWER_COUNT_MISMATCH,
    UNAUTHORIZED,
    INVALID_REQUEST,
    CONFLICT
}
