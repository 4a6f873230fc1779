package com.example.namecrawler;

import java.time.Instant;

/**
 * One failed request inside {@link AutocompleteFetcher#fetch(String)}.
 *
 * @param attempt 1-based attempt number
 */
public record RetryAttempt(
        int attempt,
        Instant timestamp,
        FailureKind kind,
        String error
) {
}
