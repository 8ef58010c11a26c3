package com.example.autoslides_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure categories surfaced to callers when a run or a tool invocation cannot complete.
 */
public enum ErrorCategory {
    CONFIGURATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    GENERATION_ERROR(HttpStatus.BAD_GATEWAY),
    IMAGE_FETCH_ERROR(HttpStatus.BAD_GATEWAY),
    COMPOSITION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    EXPORT_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    CANCELLED(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCategory(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
