package com.example.autoslides_backend.exception;

/**
 * Image search failure. Absorbed by {@link com.example.autoslides_backend.service.ImageFetcher} into an empty result.
 */
public class ImageFetchException extends AutoSlidesException {

    public ImageFetchException(String message) {
        super(ErrorCategory.IMAGE_FETCH_ERROR, message);
    }

    public ImageFetchException(String message, Throwable cause) {
        super(ErrorCategory.IMAGE_FETCH_ERROR, message, cause);
    }
}
