package com.example.namecrawler;

/**
 * Classification of a query attempt that did not produce a usable page.
 */
public enum FailureKind {
    RATE_LIMITED(true),
    SERVER_ERROR(true),
    NETWORK_ERROR(true),
    MALFORMED_RESPONSE(false),
    UNEXPECTED_STATUS(false),
    RETRIES_EXHAUSTED(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
