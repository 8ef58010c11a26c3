package com.example.autoslides_backend.exception;

/**
 * Missing or invalid credentials or template. Raised at startup and never retried.
 */
public class ConfigurationException extends AutoSlidesException {

    public ConfigurationException(String message) {
        super(ErrorCategory.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCategory.CONFIGURATION_ERROR, message, cause);
    }
}
