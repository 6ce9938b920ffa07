package com.lernify.road.api;

import com.lernify.road.error.ErrorKind;
import com.lernify.road.error.LernifyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(LernifyException.class)
    public ResponseEntity<ApiError> handle(LernifyException e) {
        HttpStatus status = statusOf(e.kind());
        log.warn("Request rejected with {} ({}): {}", status.value(), e.kind(), e.getMessage());
        return ResponseEntity.status(status).body(new ApiError(e.kind().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        log.warn("Request body failed validation: {}", detail);
        return ResponseEntity.badRequest().body(new ApiError(ErrorKind.INVALID_REQUEST.name(), detail));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ApiError(ErrorKind.INVALID_REQUEST.name(), "Malformed request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            log.warn("Request failed with {}: {}", errorResponse.getStatusCode().value(), e.getMessage());
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(new ApiError("REQUEST_FAILED", e.getMessage()));
        }
        log.error("Unexpected failure", e);
        return ResponseEntity.internalServerError().body(new ApiError("INTERNAL_ERROR", "Internal server error"));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case DOMAIN_NOT_FOUND, STEP_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case OUT_OF_SEQUENCE, ANSWER_COUNT_MISMATCH, INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case CONFLICT -> HttpStatus.CONFLICT;
        };
    }

    public record ApiError(String code, String detail) {}
}
