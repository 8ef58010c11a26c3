package com.example.autoslides_backend.exception;

/**
 * Text generation could not produce a script, after retries where they apply.
 */
public class GenerationException extends AutoSlidesException {

    public GenerationException(String message) {
        super(ErrorCategory.GENERATION_ERROR, message);
    }

    public GenerationException(String message, Throwable cause) {
        super(ErrorCategory.GENERATION_ERROR, message, cause);
    }
}
