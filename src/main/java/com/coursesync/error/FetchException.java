package com.coursesync.error;

import java.io.IOException;

/**
 * Network or transport failure while reading remote bytes.
 * Retryable failures are transient (connection reset, 5xx, 429); the others
 * (404, server ignoring range requests) will not improve by asking again.
 */
public class FetchException extends IOException {

    private final boolean retryable;

    public FetchException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public FetchException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
