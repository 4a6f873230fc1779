package com.example.namecrawler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializable checkpoint payload for resuming a crawl. The frontier is not stored; it is
 * rebuilt from {@code exploredPrefixes} on load.
 */
public record CheckpointRecord(
        @JsonProperty("discovered_names") List<String> discoveredNames,
        @JsonProperty("explored_prefixes") List<String> exploredPrefixes,
        @JsonProperty("request_count") long requestCount,
        @JsonProperty("timestamp") double timestamp,
        @JsonProperty("prefix_length_stats") Map<Integer, LengthStatsSnapshot> prefixLengthStats
) {
    public CheckpointRecord {
        discoveredNames = discoveredNames == null ? List.of() : List.copyOf(discoveredNames);
        exploredPrefixes = exploredPrefixes == null ? List.of() : List.copyOf(exploredPrefixes);
        prefixLengthStats = prefixLengthStats == null ? Map.of() : new TreeMap<>(prefixLengthStats);
    }
}
