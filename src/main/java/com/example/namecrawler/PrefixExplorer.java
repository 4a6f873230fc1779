package com.example.namecrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queries one dequeued prefix and applies its expansion to the shared state: names are
 * recorded and children queued before the prefix is marked explored.
 */
final class PrefixExplorer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrefixExplorer.class);

    private final CrawlState state;
    private final Frontier frontier;
    private final AutocompleteFetcher fetcher;
    private final PrefixExpander expander;
    private final int maxResults;

    PrefixExplorer(CrawlState state, Frontier frontier, AutocompleteFetcher fetcher, PrefixExpander expander,
                   int maxResults) {
        this.state = state;
        this.frontier = frontier;
        this.fetcher = fetcher;
        this.expander = expander;
        this.maxResults = maxResults;
    }

    /**
     * @return false if the prefix was already explored and no request was made
     */
    boolean explore(String prefix) throws InterruptedException {
        if (state.explored().contains(prefix)) {
            LOGGER.debug("Skipping already explored prefix '{}'", prefix);
            return false;
        }
        LOGGER.debug("Processing prefix: '{}'", prefix);

        FetchResult result = fetcher.fetch(prefix);
        if (result.isSuccess()) {
            state.lengthStats().record(prefix.length(), result.getNames().size());
        } else {
            FailedQueryRecord failure = result.getFailure();
            state.abandonedQueries().incrementAndGet();
            LOGGER.warn("Query '{}' produced no page ({} after {}/{} attempts, last error: {}); names under it may be missing",
                    prefix, failure.getKind(), failure.getAttempts(), failure.getMaxAttempts(), failure.getLastError());
        }

        Expansion expansion = expander.expand(prefix, result.getNames(), maxResults);
        int added = state.names().addAll(expansion.namesToRecord());
        int queued = 0;
        for (ChildPrefix child : expansion.children()) {
            if (!state.explored().contains(child.prefix()) && frontier.push(child.prefix(), child.priority())) {
                queued++;
            }
        }
        if (!state.explored().markExplored(prefix)) {
            LOGGER.debug("Prefix '{}' was explored concurrently; results merged", prefix);
        }
        LOGGER.debug("Prefix '{}': {} suggestions ({} new names), {} children queued",
                prefix, result.getNames().size(), added, queued);
        return true;
    }
}
