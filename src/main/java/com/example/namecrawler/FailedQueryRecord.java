package com.example.namecrawler;

import java.time.Instant;
import java.util.List;

public class FailedQueryRecord {
    private final String prefix;
    private final int attempts;
    private final int maxAttempts;
    private final Instant lastAttemptTime;
    private final FailureKind kind;
    private final String lastError;
    private final List<RetryAttempt> retryAttempts;

    public FailedQueryRecord(String prefix,
                             int attempts,
                             int maxAttempts,
                             Instant lastAttemptTime,
                             FailureKind kind,
                             String lastError,
                             List<RetryAttempt> retryAttempts) {
        this.prefix = prefix;
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;
        this.lastAttemptTime = lastAttemptTime;
        this.kind = kind;
        this.lastError = lastError;
        this.retryAttempts = List.copyOf(retryAttempts);
    }

    public String getPrefix() {
        return prefix;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getLastError() {
        return lastError;
    }

    public List<RetryAttempt> getRetryAttempts() {
        return retryAttempts;
    }
}
