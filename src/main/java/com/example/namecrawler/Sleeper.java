package com.example.namecrawler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Blocks the calling thread for the full duration.
     */
    Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());
}
