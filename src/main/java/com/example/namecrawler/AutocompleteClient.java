package com.example.namecrawler;

import java.io.IOException;

/**
 * Issues a single autocomplete lookup. Implementations return whatever the service
 * answered; classifying the answer is left to {@link AutocompleteFetcher}.
 */
@FunctionalInterface
public interface AutocompleteClient {
    /**
     * @throws IOException on any transport failure (connect, TLS, timeout, reset)
     */
    AutocompleteResponse query(String prefix, int maxResults) throws IOException, InterruptedException;
}
