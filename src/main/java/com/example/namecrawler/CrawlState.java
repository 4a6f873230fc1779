package com.example.namecrawler;

import com.example.namecrawler.model.CheckpointRecord;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Everything a crawl run shares between workers and persists in checkpoints.
 */
public final class CrawlState {
    private final DiscoveredNames names;
    private final ExploredPrefixes explored;
    private final PrefixLengthStats lengthStats;
    private final AtomicLong requestCount;
    private final AtomicLong abandonedQueries = new AtomicLong();

    private CrawlState(DiscoveredNames names, ExploredPrefixes explored, PrefixLengthStats lengthStats, long requests) {
        this.names = names;
        this.explored = explored;
        this.lengthStats = lengthStats;
        this.requestCount = new AtomicLong(requests);
    }

    public static CrawlState fresh() {
        return new CrawlState(new DiscoveredNames(), new ExploredPrefixes(), new PrefixLengthStats(), 0L);
    }

    public static CrawlState restore(CheckpointRecord record) {
        return new CrawlState(
                new DiscoveredNames(record.discoveredNames()),
                new ExploredPrefixes(record.exploredPrefixes()),
                new PrefixLengthStats(record.prefixLengthStats()),
                record.requestCount()
        );
    }

    /**
     * Captures the current state. Explored prefixes are read before names: a worker records
     * a prefix's names before marking it explored, so every prefix in the snapshot has its
     * names in the snapshot too.
     */
    public CheckpointRecord toCheckpoint(Instant now) {
        List<String> exploredSnapshot = explored.snapshot();
        List<String> namesSnapshot = names.sortedSnapshot();
        return new CheckpointRecord(
                namesSnapshot,
                exploredSnapshot,
                requestCount.get(),
                now.toEpochMilli() / 1000.0,
                lengthStats.snapshot()
        );
    }

    public DiscoveredNames names() {
        return names;
    }

    public ExploredPrefixes explored() {
        return explored;
    }

    public PrefixLengthStats lengthStats() {
        return lengthStats;
    }

    public AtomicLong requestCount() {
        return requestCount;
    }

    public AtomicLong abandonedQueries() {
        return abandonedQueries;
    }
}
