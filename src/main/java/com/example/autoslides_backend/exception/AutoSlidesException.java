package com.example.autoslides_backend.exception;

/**
 * Base type for every failure the deck pipeline reports with a category.
 */
public abstract class AutoSlidesException extends RuntimeException {
    private final ErrorCategory category;

    protected AutoSlidesException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected AutoSlidesException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
