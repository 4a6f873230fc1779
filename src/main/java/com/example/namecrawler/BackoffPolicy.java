package com.example.namecrawler;

import java.time.Duration;

/**
 * Retry budget and sleep schedule applied by {@link AutocompleteFetcher} to failed queries.
 * Each delay is stretched by up to {@code jitterRatio} of itself and then capped, so no
 * sleep exceeds the configured ceiling for its kind.
 */
public record BackoffPolicy(
        int maxRetries,
        Duration rateLimitBase,
        Duration rateLimitCap,
        Duration serverErrorStep,
        Duration serverErrorCap,
        Duration networkBase,
        Duration networkCap,
        double jitterRatio
) {
    private static final int MAX_EXPONENT = 20;

    public BackoffPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative.");
        }
        if (jitterRatio < 0) {
            throw new IllegalArgumentException("jitterRatio must not be negative.");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(
                8,
                Duration.ofSeconds(1),
                Duration.ofSeconds(90),
                Duration.ofSeconds(5),
                Duration.ofSeconds(45),
                Duration.ofSeconds(2),
                Duration.ofSeconds(45),
                0.3
        );
    }

    /**
     * Returns the sleep before retry number {@code attempt + 1}.
     *
     * @param kind    classification of the failed attempt
     * @param attempt zero-based index of the attempt that failed
     * @param jitter  random sample in {@code [0, 1)}
     */
    public Duration delayFor(FailureKind kind, int attempt, double jitter) {
        Duration base;
        Duration cap;
        switch (kind) {
            case RATE_LIMITED:
                base = exponential(rateLimitBase, attempt);
                cap = rateLimitCap;
                break;
            case SERVER_ERROR:
                base = serverErrorStep.multipliedBy(Math.max(attempt, 0) + 1L);
                cap = serverErrorCap;
                break;
            case NETWORK_ERROR:
                base = exponential(networkBase, attempt);
                cap = networkCap;
                break;
            default:
                return Duration.ZERO;
        }
        long extraNanos = Math.round(base.toNanos() * jitterRatio * Math.max(0.0, jitter));
        return min(base.plusNanos(extraNanos), cap);
    }

    private static Duration exponential(Duration base, int attempt) {
        return base.multipliedBy(1L << Math.min(Math.max(attempt, 0), MAX_EXPONENT));
    }

    private static Duration min(Duration left, Duration right) {
        return left.compareTo(right) <= 0 ? left : right;
    }
}
