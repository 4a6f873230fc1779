package com.example.namecrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Process-wide pause between requests, tuned from observed outcomes.
 * <p>
 * Each failure raises the delay by half and clears the rolling success count. The delay
 * only decays, by 3%, after a long run of mostly successful requests. The rolling counters
 * then drop back to a small baseline rather than zero. The delay never leaves
 * {@code [minDelay, maxDelay]}.
 */
public final class AdaptiveRateController {
    private static final Logger LOGGER = LoggerFactory.getLogger(AdaptiveRateController.class);
    private static final double FAILURE_FACTOR = 1.5;
    private static final double DECAY_FACTOR = 0.97;
    private static final double DECAY_SUCCESS_RATIO = 0.85;
    private static final long DECAY_MIN_SUCCESSES = 30;
    private static final long BASELINE_SUCCESSES = 15;
    private static final long BASELINE_FAILURES = 2;
    private static final int SHORT_PREFIX_LENGTH = 3;
    private static final double LONG_PREFIX_FACTOR = 0.8;

    private final double minDelayMillis;
    private final double maxDelayMillis;
    private double delayMillis;
    private long rollingSuccesses;
    private long rollingFailures;
    private long totalSuccesses;
    private long totalFailures;

    public AdaptiveRateController(Duration initialDelay, Duration minDelay, Duration maxDelay) {
        if (minDelay.compareTo(maxDelay) > 0) {
            throw new IllegalArgumentException("minDelay must not exceed maxDelay");
        }
        this.minDelayMillis = toMillis(minDelay);
        this.maxDelayMillis = toMillis(maxDelay);
        this.delayMillis = clamp(toMillis(initialDelay));
    }

    public synchronized void recordSuccess() {
        rollingSuccesses++;
        totalSuccesses++;
        double ratio = (double) rollingSuccesses / Math.max(1L, rollingSuccesses + rollingFailures);
        if (ratio > DECAY_SUCCESS_RATIO && rollingSuccesses > DECAY_MIN_SUCCESSES) {
            delayMillis = clamp(delayMillis * DECAY_FACTOR);
            rollingSuccesses = BASELINE_SUCCESSES;
            rollingFailures = BASELINE_FAILURES;
            LOGGER.info("Decreased delay to {} ms after consistent success", Math.round(delayMillis));
        }
    }

    public synchronized void recordFailure() {
        rollingFailures++;
        totalFailures++;
        delayMillis = clamp(delayMillis * FAILURE_FACTOR);
        rollingSuccesses = 0;
        LOGGER.info("Increased delay to {} ms after failure", Math.round(delayMillis));
    }

    public synchronized Duration currentDelay() {
        return toDuration(delayMillis);
    }

    /**
     * Pause to apply after finishing a prefix. Longer prefixes draw fewer results and
     * get a shortened pause, never below the minimum.
     */
    public synchronized Duration delayFor(int prefixLength) {
        if (prefixLength > SHORT_PREFIX_LENGTH) {
            return toDuration(Math.max(minDelayMillis, delayMillis * LONG_PREFIX_FACTOR));
        }
        return toDuration(delayMillis);
    }

    public synchronized long totalSuccesses() {
        return totalSuccesses;
    }

    public synchronized long totalFailures() {
        return totalFailures;
    }

    public Duration minDelay() {
        return toDuration(minDelayMillis);
    }

    public Duration maxDelay() {
        return toDuration(maxDelayMillis);
    }

    private double clamp(double value) {
        return Math.min(maxDelayMillis, Math.max(minDelayMillis, value));
    }

    private static double toMillis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }

    private static Duration toDuration(double millis) {
        return Duration.ofNanos(Math.round(millis * 1_000_000.0));
    }
}
