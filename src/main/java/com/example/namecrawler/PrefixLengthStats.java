package com.example.namecrawler;

import com.example.namecrawler.model.LengthStatsSnapshot;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per prefix length, how many queries ran and how many returned at least one name.
 * Diagnostic only; nothing in the crawl depends on these numbers.
 */
public final class PrefixLengthStats {
    private final Map<Integer, LengthStats> byLength = new ConcurrentHashMap<>();

    public PrefixLengthStats() {
    }

    public PrefixLengthStats(Map<Integer, LengthStatsSnapshot> restored) {
        restored.forEach((length, stats) -> byLength.put(length, new LengthStats(stats.success(), stats.queries())));
    }

    public void record(int prefixLength, int resultCount) {
        byLength.computeIfAbsent(prefixLength, ignored -> new LengthStats()).record(resultCount);
    }

    public SortedMap<Integer, LengthStatsSnapshot> snapshot() {
        SortedMap<Integer, LengthStatsSnapshot> snapshot = new TreeMap<>();
        byLength.forEach((length, stats) -> snapshot.put(length, LengthStatsSnapshot.from(stats)));
        return snapshot;
    }
}
