package com.example.namecrawler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * Runs one prefix query to completion, retrying rate limits, server errors and transport
 * failures per the {@link BackoffPolicy}. Every attempt is a fresh request and counts
 * toward the shared request counter. Every retryable failure is reported to the
 * {@link AdaptiveRateController} before its backoff sleep.
 */
public final class AutocompleteFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(AutocompleteFetcher.class);

    private final AutocompleteClient client;
    private final AdaptiveRateController rateController;
    private final BackoffPolicy backoffPolicy;
    private final int maxResults;
    private final Duration requestJitter;
    private final AtomicLong requestCount;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final ObjectMapper mapper = new ObjectMapper();

    public AutocompleteFetcher(AutocompleteClient client,
                               AdaptiveRateController rateController,
                               BackoffPolicy backoffPolicy,
                               int maxResults,
                               Duration requestJitter,
                               AtomicLong requestCount,
                               Sleeper sleeper) {
        this(client, rateController, backoffPolicy, maxResults, requestJitter, requestCount, sleeper,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    AutocompleteFetcher(AutocompleteClient client,
                        AdaptiveRateController rateController,
                        BackoffPolicy backoffPolicy,
                        int maxResults,
                        Duration requestJitter,
                        AtomicLong requestCount,
                        Sleeper sleeper,
                        DoubleSupplier random) {
        this.client = client;
        this.rateController = rateController;
        this.backoffPolicy = backoffPolicy;
        this.maxResults = maxResults;
        this.requestJitter = requestJitter;
        this.requestCount = requestCount;
        this.sleeper = sleeper;
        this.random = random;
    }

    public FetchResult fetch(String prefix) throws InterruptedException {
        int maxAttempts = backoffPolicy.maxRetries() + 1;
        List<RetryAttempt> retryAttempts = new ArrayList<>();
        for (int attempt = 0; ; attempt++) {
            pauseBeforeRequest();
            FailureKind kind;
            String error;
            requestCount.incrementAndGet();
            try {
                AutocompleteResponse response = client.query(prefix, maxResults);
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    Optional<List<String>> names = parseResults(prefix, response.body());
                    if (names.isEmpty()) {
                        return FetchResult.failure(new FailedQueryRecord(prefix, attempt + 1, maxAttempts,
                                Instant.now(), FailureKind.MALFORMED_RESPONSE, "Unexpected response body", retryAttempts));
                    }
                    rateController.recordSuccess();
                    return FetchResult.success(prefix, names.get(), attempt + 1);
                }
                kind = classify(status);
                error = "HTTP " + status;
                if (!kind.isRetryable()) {
                    LOGGER.error("Error status code {} for query '{}'; not retrying", status, prefix);
                    return FetchResult.failure(new FailedQueryRecord(prefix, attempt + 1, maxAttempts,
                            Instant.now(), kind, error, retryAttempts));
                }
            } catch (IOException ex) {
                kind = FailureKind.NETWORK_ERROR;
                error = ex.toString();
            }

            rateController.recordFailure();
            retryAttempts.add(new RetryAttempt(attempt + 1, Instant.now(), kind, error));
            if (attempt + 1 >= maxAttempts) {
                LOGGER.error("Max retries reached for query '{}' after {} attempts (last: {}). Skipping.",
                        prefix, attempt + 1, error);
                return FetchResult.failure(new FailedQueryRecord(prefix, attempt + 1, maxAttempts,
                        Instant.now(), FailureKind.RETRIES_EXHAUSTED, error, retryAttempts));
            }
            Duration wait = backoffPolicy.delayFor(kind, attempt, random.getAsDouble());
            LOGGER.warn("{} for query '{}' ({}). Sleeping {} ms before retry {}/{}",
                    kind, prefix, error, wait.toMillis(), attempt + 1, backoffPolicy.maxRetries());
            sleeper.sleep(wait);
        }
    }

    private static FailureKind classify(int status) {
        if (status == 429) {
            return FailureKind.RATE_LIMITED;
        }
        return status >= 500 ? FailureKind.SERVER_ERROR : FailureKind.UNEXPECTED_STATUS;
    }

    private void pauseBeforeRequest() throws InterruptedException {
        if (requestJitter.isZero()) {
            return;
        }
        sleeper.sleep(Duration.ofNanos((long) (requestJitter.toNanos() * random.getAsDouble())));
    }

    /**
     * Reads {@code {"results": [...], "count": n}}. Any other shape is reported as empty.
     */
    private Optional<List<String>> parseResults(String prefix, String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Query '{}' returned a body that is not JSON: {}", prefix, ex.getOriginalMessage());
            return Optional.empty();
        }
        JsonNode results = root == null ? null : root.get("results");
        if (results == null || !results.isArray()) {
            LOGGER.warn("Unexpected response format for query '{}': {}", prefix, abbreviate(body));
            return Optional.empty();
        }
        List<String> names = new ArrayList<>(results.size());
        for (JsonNode node : results) {
            if (!node.isTextual()) {
                LOGGER.warn("Query '{}' returned a non-string result: {}", prefix, node);
                return Optional.empty();
            }
            names.add(node.asText());
        }
        JsonNode count = root.get("count");
        LOGGER.debug("Query '{}' returned {} suggestions (count: {})",
                prefix, names.size(), count == null ? "n/a" : count.asText());
        if (!names.isEmpty()) {
            LOGGER.trace("First: {}, Last: {}", names.get(0), names.get(names.size() - 1));
        }
        return Optional.of(names);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "<empty>";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
