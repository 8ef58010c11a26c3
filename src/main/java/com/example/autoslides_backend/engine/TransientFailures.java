package com.example.autoslides_backend.engine;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.netty.http.client.PrematureCloseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Retry classification shared by the HTTP engines: timeouts, dropped connections, 429 and 5xx are transient,
 * everything else (auth failures, other 4xx, parse errors) is not.
 */
public final class TransientFailures {
    private TransientFailures() {}

    public static boolean isRetryable(Throwable throwable) {
        if (throwable == null) return false;
        UpstreamStatusException status = findCause(throwable, UpstreamStatusException.class);
        if (status != null) {
            return status.isRateLimited() || status.getStatus() >= 500;
        }
        if (findCause(throwable, TimeoutException.class) != null) return true;
        if (findCause(throwable, PrematureCloseException.class) != null) return true;
        if (findCause(throwable, WebClientRequestException.class) != null) return true;
        return findCause(throwable, IOException.class) != null;
    }

    public static Throwable rootCause(Throwable throwable) {
        Throwable cursor = throwable;
        Throwable prev = null;
        while (cursor != null && cursor != prev) {
            prev = cursor;
            cursor = cursor.getCause();
        }
        return prev;
    }

    public static String describe(Throwable throwable) {
        Throwable root = rootCause(throwable);
        if (root == null) return "unknown";
        return root.getClass().getSimpleName() + (root.getMessage() == null ? "" : ": " + root.getMessage());
    }

    /** {@code true} when the failure comes from the calling thread being interrupted while it blocked. */
    public static boolean isInterruption(Throwable throwable) {
        return findCause(throwable, InterruptedException.class) != null;
    }

    static <T extends Throwable> T findCause(Throwable throwable, Class<T> type) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (type.isInstance(cursor)) {
                return type.cast(cursor);
            }
            if (cursor.getCause() == cursor) break;
            cursor = cursor.getCause();
        }
        return null;
    }
}
