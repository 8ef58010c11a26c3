package com.example.autoslides_backend.exception;

/**
 * Request or tool arguments outside the accepted bounds.
 */
public class InvalidRequestException extends AutoSlidesException {

    public InvalidRequestException(String message) {
        super(ErrorCategory.INVALID_REQUEST, message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(ErrorCategory.INVALID_REQUEST, message, cause);
    }
}
