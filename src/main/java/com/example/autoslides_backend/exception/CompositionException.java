package com.example.autoslides_backend.exception;

/**
 * Template or layout failure that makes the deck impossible to render.
 */
public class CompositionException extends AutoSlidesException {

    public CompositionException(String message) {
        super(ErrorCategory.COMPOSITION_ERROR, message);
    }

    public CompositionException(String message, Throwable cause) {
        super(ErrorCategory.COMPOSITION_ERROR, message, cause);
    }
}
