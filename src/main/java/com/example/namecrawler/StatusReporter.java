package com.example.namecrawler;

import com.example.namecrawler.model.LengthStatsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Periodic progress line for long crawls: totals, throughput, current delay and the
 * per-length hit rate.
 */
final class StatusReporter implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatusReporter.class);

    private final CrawlState state;
    private final Frontier frontier;
    private final AdaptiveRateController rateController;
    private final Instant startedAt;
    private final long startingRequests;

    StatusReporter(CrawlState state, Frontier frontier, AdaptiveRateController rateController, Instant startedAt) {
        this.state = state;
        this.frontier = frontier;
        this.rateController = rateController;
        this.startedAt = startedAt;
        this.startingRequests = state.requestCount().get();
    }

    @Override
    public void run() {
        long requests = state.requestCount().get();
        int names = state.names().size();
        double minutes = Math.max(Duration.between(startedAt, Instant.now()).toMillis() / 60_000.0, 0.01);

        LOGGER.info("Status: {} names found, {} requests made, {} prefixes queued, {} in flight",
                names, requests, frontier.size(), frontier.inFlight());
        LOGGER.info("Rate: {} names/min, {} requests/min this session",
                String.format("%.1f", names / minutes),
                String.format("%.1f", (requests - startingRequests) / minutes));
        LOGGER.info("Current delay: {} ms, success/failure: {}/{}",
                rateController.currentDelay().toMillis(),
                rateController.totalSuccesses(),
                rateController.totalFailures());

        Map<Integer, LengthStatsSnapshot> byLength = state.lengthStats().snapshot();
        if (!byLength.isEmpty()) {
            LOGGER.info("Prefix length statistics:");
            byLength.forEach((length, stats) -> {
                if (stats.queries() > 0) {
                    LOGGER.info("  Length {}: {}/{} ({}% success)", length, stats.success(), stats.queries(),
                            String.format("%.1f", stats.successRate() * 100));
                }
            });
        }
    }
}
