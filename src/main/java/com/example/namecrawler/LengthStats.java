package com.example.namecrawler;

import java.util.concurrent.atomic.AtomicLong;

public final class LengthStats {
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong queries = new AtomicLong();

    public LengthStats() {
    }

    public LengthStats(long successes, long queries) {
        this.successes.set(successes);
        this.queries.set(queries);
    }

    public void record(int resultCount) {
        queries.incrementAndGet();
        if (resultCount > 0) {
            successes.incrementAndGet();
        }
    }

    public long successes() {
        return successes.get();
    }

    public long queries() {
        return queries.get();
    }
}
