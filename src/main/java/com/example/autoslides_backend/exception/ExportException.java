package com.example.autoslides_backend.exception;

/**
 * Final artifact write failure. No partial file is left behind when this is thrown.
 */
public class ExportException extends AutoSlidesException {

    public ExportException(String message) {
        super(ErrorCategory.EXPORT_ERROR, message);
    }

    public ExportException(String message, Throwable cause) {
        super(ErrorCategory.EXPORT_ERROR, message, cause);
    }
}
