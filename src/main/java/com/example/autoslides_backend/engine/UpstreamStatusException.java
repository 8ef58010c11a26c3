package com.example.autoslides_backend.engine;

/**
 * Non-2xx answer from an upstream HTTP service, kept with its status so retry filters can classify it.
 */
public class UpstreamStatusException extends RuntimeException {
    private final int status;

    public UpstreamStatusException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    public boolean isRateLimited() {
        return status == 429;
    }

    public boolean isAuthFailure() {
        return status == 401 || status == 403;
    }
}
