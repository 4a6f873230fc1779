package com.example.namecrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(5);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar name-crawler.jar <config.json>");
            System.exit(1);
        }
        Path configPath = Path.of(args[0]);
        CrawlerConfig config = new ConfigLoader().load(configPath);
        CheckpointManager checkpointManager = new CheckpointManager(config.checkpointFile());
        RequestLimiter limiter = config.maxRequests()
                .map(max -> (RequestLimiter) requests -> requests >= max)
                .orElse(RequestLimiter.NO_LIMIT);
        AutocompleteClient client = new HttpAutocompleteClient(
                config.baseUrl(),
                config.apiVersion(),
                config.connectTimeout(),
                config.requestTimeout()
        );
        CrawlerEngine engine = new CrawlerEngine(config, checkpointManager, client, limiter, Sleeper.SYSTEM);

        // Ctrl-C: stop popping new prefixes and hold the JVM open until the final checkpoint lands.
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook(engine, SHUTDOWN_GRACE), "crawler-shutdown"));

        CrawlSummary summary = engine.run();
        LOGGER.info("{}: {} names from {} requests ({} names per request)",
                summary.completed() ? "Extraction complete" : "Extraction paused",
                summary.totalNames(),
                summary.totalRequests(),
                String.format("%.2f", summary.namesPerRequest()));
    }

    /**
     * Stops a crawl still in progress at JVM exit. A run that already returned is left alone.
     */
    static Runnable shutdownHook(CrawlerEngine engine, Duration grace) {
        return () -> {
            try {
                if (engine.awaitFinished(Duration.ZERO)) {
                    return;
                }
                engine.requestStop("shutdown signal");
                if (!engine.awaitFinished(grace)) {
                    LOGGER.warn("Crawler did not finish within {}; exiting without a final checkpoint", grace);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while waiting for the crawler to save its checkpoint", ex);
            }
        };
    }
}
