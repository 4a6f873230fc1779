package com.example.namecrawler;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable runtime settings for the crawler.
 */
public record CrawlerConfig(
        String baseUrl,
        int apiVersion,
        int maxResults,
        int threadCount,
        String primaryCharacters,
        String specialCharacters,
        Duration initialDelay,
        Duration minDelay,
        Duration maxDelay,
        BackoffPolicy backoffPolicy,
        Duration requestJitter,
        Duration connectTimeout,
        Duration requestTimeout,
        Duration pollTimeout,
        Duration statusInterval,
        Path outputDirectory,
        Path checkpointFile,
        Path resultsFile,
        int checkpointRequestInterval,
        Duration checkpointTimeInterval,
        Optional<Long> maxRequests,
        boolean s3SyncEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
    public PrefixAlphabet alphabet() {
        return PrefixAlphabet.of(primaryCharacters, specialCharacters);
    }
}
