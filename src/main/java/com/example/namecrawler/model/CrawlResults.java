package com.example.namecrawler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final output file: every discovered name in sorted order.
 */
public record CrawlResults(
        @JsonProperty("total_requests") long totalRequests,
        @JsonProperty("total_names") int totalNames,
        @JsonProperty("names") List<String> names
) {
    public static CrawlResults of(long totalRequests, List<String> sortedNames) {
        return new CrawlResults(totalRequests, sortedNames.size(), sortedNames);
    }
}
