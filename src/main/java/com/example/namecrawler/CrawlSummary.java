package com.example.namecrawler;

import java.time.Duration;

/**
 * Totals reported when {@link CrawlerEngine#run()} returns.
 *
 * @param completed false when the run was paused by a stop request or the request limiter
 */
public record CrawlSummary(
        boolean completed,
        long totalRequests,
        int totalNames,
        int exploredPrefixes,
        long abandonedQueries,
        Duration elapsed
) {
    public double namesPerRequest() {
        return totalRequests == 0 ? 0.0 : (double) totalNames / totalRequests;
    }
}
