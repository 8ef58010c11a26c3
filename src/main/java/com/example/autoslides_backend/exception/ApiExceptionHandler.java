package com.example.autoslides_backend.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.UUID;

/**
 * Maps pipeline and validation failures to {@link ApiError} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AutoSlidesException.class)
    public ResponseEntity<ApiError> handlePipeline(AutoSlidesException ex, HttpServletRequest request) {
        String errorId = newErrorId();
        HttpStatus status = ex.getCategory().httpStatus();
        if (status.is5xxServerError()) {
            LOGGER.error("Request failed [{}] category={} path={} message={}", errorId, ex.getCategory(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            LOGGER.warn("Request rejected [{}] category={} path={} message={}", errorId, ex.getCategory(), request.getRequestURI(), ex.getMessage());
        }
        return body(status, errorId, ex.getCategory().name(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String errorId = newErrorId();
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("Validation failed");
        LOGGER.warn("Validation error [{}]: {}", errorId, message);
        return body(HttpStatus.BAD_REQUEST, errorId, ErrorCategory.INVALID_REQUEST.name(), message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        String errorId = newErrorId();
        LOGGER.warn("Unreadable request body [{}]: {}", errorId, ex.getMostSpecificCause().getMessage());
        return body(HttpStatus.BAD_REQUEST, errorId, ErrorCategory.INVALID_REQUEST.name(), "Malformed request body", request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleStatus(ResponseStatusException ex, HttpServletRequest request) {
        String errorId = newErrorId();
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String category = status.is4xxClientError() ? ErrorCategory.INVALID_REQUEST.name() : ErrorCategory.INTERNAL_ERROR.name();
        LOGGER.warn("Request rejected [{}] status={} reason={}", errorId, status.value(), ex.getReason());
        return body(status, errorId, category, ex.getReason(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        String errorId = newErrorId();
        LOGGER.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ErrorCategory.INTERNAL_ERROR.name(),
                "An unexpected error occurred. Please try again later.", request);
    }

    private ResponseEntity<ApiError> body(HttpStatus status, String errorId, String category, String message, HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, category, message, request.getRequestURI(), Instant.now()));
    }

    private String newErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
