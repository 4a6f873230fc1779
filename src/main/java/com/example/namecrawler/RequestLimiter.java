package com.example.namecrawler;

public interface RequestLimiter {
    /**
     * Returns true if the crawl should pause after the given number of requests.
     */
    boolean shouldStop(long requestCount);

    /**
     * Default limiter used in production runs (never stops early).
     */
    RequestLimiter NO_LIMIT = requestCount -> false;
}
