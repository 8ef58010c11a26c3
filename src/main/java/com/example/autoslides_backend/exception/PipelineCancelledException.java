package com.example.autoslides_backend.exception;

public class PipelineCancelledException extends AutoSlidesException {

    public PipelineCancelledException(String message, Throwable cause) {
        super(ErrorCategory.CANCELLED, message, cause);
    }
}
