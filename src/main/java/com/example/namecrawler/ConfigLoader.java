package com.example.namecrawler;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Reads the JSON run configuration and fills in the production defaults.
 * Durations may be given as ISO-8601 strings ({@code "PT0.8S"}) or as seconds ({@code 0.8}).
 */
public class ConfigLoader {
    private static final int DEFAULT_API_VERSION = 3;
    private static final int DEFAULT_MAX_RESULTS = 100;
    private static final int DEFAULT_THREAD_COUNT = 10;
    private static final int DEFAULT_CHECKPOINT_REQUEST_INTERVAL = 200;
    private static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(1000);
    private static final Duration DEFAULT_MIN_DELAY = Duration.ofMillis(800);
    private static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(3000);
    private static final Duration DEFAULT_REQUEST_JITTER = Duration.ofMillis(300);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_STATUS_INTERVAL = Duration.ofSeconds(30);
    private static final Duration DEFAULT_CHECKPOINT_TIME_INTERVAL = Duration.ofMinutes(5);
    private static final String DEFAULT_CHECKPOINT_FILE = "autocomplete_checkpoint.json";
    private static final String DEFAULT_RESULTS_FILE = "discovered_names.json";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public CrawlerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.baseUrl == null || raw.baseUrl.isBlank()) {
            throw new IllegalArgumentException("Config must include a baseUrl.");
        }

        int apiVersion = positiveOr(raw.apiVersion, DEFAULT_API_VERSION);
        int maxResults = positiveOr(raw.maxResults, DEFAULT_MAX_RESULTS);
        int threadCount = positiveOr(raw.threadCount, DEFAULT_THREAD_COUNT);
        int checkpointRequestInterval = positiveOr(raw.checkpointRequestInterval, DEFAULT_CHECKPOINT_REQUEST_INTERVAL);

        String primaryCharacters = raw.primaryCharacters == null
                ? PrefixAlphabet.DEFAULT_PRIMARY
                : raw.primaryCharacters;
        String specialCharacters = raw.specialCharacters == null
                ? PrefixAlphabet.DEFAULT_SPECIAL
                : raw.specialCharacters;
        // Fails fast on duplicate or missing characters.
        PrefixAlphabet.of(primaryCharacters, specialCharacters);

        Duration initialDelay = durationOr(raw.initialDelay, DEFAULT_INITIAL_DELAY);
        Duration minDelay = durationOr(raw.minDelay, DEFAULT_MIN_DELAY);
        Duration maxDelay = durationOr(raw.maxDelay, DEFAULT_MAX_DELAY);
        if (minDelay.compareTo(maxDelay) > 0) {
            throw new IllegalArgumentException("minDelay must not exceed maxDelay.");
        }

        BackoffPolicy defaults = BackoffPolicy.defaults();
        BackoffPolicy backoffPolicy = new BackoffPolicy(
                raw.maxRetries != null && raw.maxRetries >= 0 ? raw.maxRetries : defaults.maxRetries(),
                durationOr(raw.rateLimitBackoffBase, defaults.rateLimitBase()),
                durationOr(raw.rateLimitBackoffCap, defaults.rateLimitCap()),
                durationOr(raw.serverErrorBackoffStep, defaults.serverErrorStep()),
                durationOr(raw.serverErrorBackoffCap, defaults.serverErrorCap()),
                durationOr(raw.networkBackoffBase, defaults.networkBase()),
                durationOr(raw.networkBackoffCap, defaults.networkCap()),
                raw.jitterRatio != null && raw.jitterRatio >= 0 ? raw.jitterRatio : defaults.jitterRatio()
        );

        Path outputDirectory = Path.of(optionalString(raw.outputDirectory, "output"));
        Path checkpointFile = Optional.ofNullable(raw.checkpointFile)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .orElse(outputDirectory.resolve(DEFAULT_CHECKPOINT_FILE));
        Path resultsFile = Optional.ofNullable(raw.resultsFile)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .orElse(outputDirectory.resolve(DEFAULT_RESULTS_FILE));

        Optional<Long> maxRequests = Optional.ofNullable(raw.maxRequests).filter(value -> value > 0);
        boolean s3SyncEnabled = raw.s3SyncEnabled != null && raw.s3SyncEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3SyncEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3SyncEnabled is true.");
        }

        return new CrawlerConfig(
                stripTrailingSlash(raw.baseUrl.trim()),
                apiVersion,
                maxResults,
                threadCount,
                primaryCharacters,
                specialCharacters,
                clamp(initialDelay, minDelay, maxDelay),
                minDelay,
                maxDelay,
                backoffPolicy,
                durationOr(raw.requestJitter, DEFAULT_REQUEST_JITTER),
                durationOr(raw.connectTimeout, DEFAULT_CONNECT_TIMEOUT),
                durationOr(raw.requestTimeout, DEFAULT_REQUEST_TIMEOUT),
                durationOr(raw.pollTimeout, DEFAULT_POLL_TIMEOUT),
                durationOr(raw.statusInterval, DEFAULT_STATUS_INTERVAL),
                outputDirectory,
                checkpointFile,
                resultsFile,
                checkpointRequestInterval,
                durationOr(raw.checkpointTimeInterval, DEFAULT_CHECKPOINT_TIME_INTERVAL),
                maxRequests,
                s3SyncEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private Duration durationOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() ? fallback : value;
    }

    private Duration clamp(Duration value, Duration min, Duration max) {
        if (value.compareTo(min) < 0) {
            return min;
        }
        return value.compareTo(max) > 0 ? max : value;
    }

    private String stripTrailingSlash(String url) {
        return url.replaceAll("/+$", "");
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String baseUrl;
        public Integer apiVersion;
        public Integer maxResults;
        public Integer threadCount;
        public String primaryCharacters;
        public String specialCharacters;
        public Duration initialDelay;
        public Duration minDelay;
        public Duration maxDelay;
        public Integer maxRetries;
        public Duration rateLimitBackoffBase;
        public Duration rateLimitBackoffCap;
        public Duration serverErrorBackoffStep;
        public Duration serverErrorBackoffCap;
        public Duration networkBackoffBase;
        public Duration networkBackoffCap;
        public Double jitterRatio;
        public Duration requestJitter;
        public Duration connectTimeout;
        public Duration requestTimeout;
        public Duration pollTimeout;
        public Duration statusInterval;
        public String outputDirectory;
        public String checkpointFile;
        public String resultsFile;
        public Integer checkpointRequestInterval;
        public Duration checkpointTimeInterval;
        public Long maxRequests;
        public Boolean s3SyncEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
