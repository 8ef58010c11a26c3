package com.example.autoslides_backend.exception;

/**
 * Raised at the HTTP edge when a pipeline run came back as a failure result.
 */
public class RunFailedException extends AutoSlidesException {

    public RunFailedException(ErrorCategory category, String message) {
        super(category, message);
    }
}
