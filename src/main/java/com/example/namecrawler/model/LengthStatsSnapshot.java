package com.example.namecrawler.model;

import com.example.namecrawler.LengthStats;

public record LengthStatsSnapshot(
        long success,
        long queries
) {
    /**
     * Creates an immutable snapshot of the running per-length counters.
     */
    public static LengthStatsSnapshot from(LengthStats stats) {
        return new LengthStatsSnapshot(stats.successes(), stats.queries());
    }

    public double successRate() {
        return queries == 0 ? 0.0 : (double) success / queries;
    }
}
