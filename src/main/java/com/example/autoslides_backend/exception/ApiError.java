package com.example.autoslides_backend.exception;

import java.time.Instant;

/**
 * Error descriptor returned by the HTTP layer.
 *
 * @param errorId   short id repeated in the server log for correlation.
 * @param category  machine-readable failure category.
 * @param message   human readable reason.
 * @param path      request path that failed.
 * @param timestamp moment the error was produced.
 */
public record ApiError(String errorId, String category, String message, String path, Instant timestamp) {
}
