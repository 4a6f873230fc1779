package com.example.namecrawler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides when the next periodic checkpoint is due: after {@code requestInterval} requests
 * or {@code timeInterval} of wall-clock time since the last save, whichever comes first.
 */
final class CheckpointTrigger {
    private final long requestInterval;
    private final Duration timeInterval;
    private final Clock clock;
    private long requestsAtLastSave;
    private Instant lastSave;

    CheckpointTrigger(long requestInterval, Duration timeInterval, Clock clock, long startingRequests) {
        this.requestInterval = requestInterval;
        this.timeInterval = timeInterval;
        this.clock = clock;
        this.requestsAtLastSave = startingRequests;
        this.lastSave = clock.instant();
    }

    synchronized boolean isDue(long requestCount) {
        if (requestCount - requestsAtLastSave >= requestInterval) {
            return true;
        }
        return Duration.between(lastSave, clock.instant()).compareTo(timeInterval) >= 0;
    }

    synchronized void markSaved(long requestCount) {
        requestsAtLastSave = requestCount;
        lastSave = clock.instant();
    }
}
