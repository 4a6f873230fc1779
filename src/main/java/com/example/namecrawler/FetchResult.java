package com.example.namecrawler;

import java.util.List;

/**
 * Outcome of {@link AutocompleteFetcher#fetch(String)}: either the page of names, or the
 * failure record. A failed result always reports an empty page.
 */
public class FetchResult {
    private final String prefix;
    private final List<String> names;
    private final int attempts;
    private final FailedQueryRecord failure;

    private FetchResult(String prefix, List<String> names, int attempts, FailedQueryRecord failure) {
        this.prefix = prefix;
        this.names = names;
        this.attempts = attempts;
        this.failure = failure;
    }

    public static FetchResult success(String prefix, List<String> names, int attempts) {
        return new FetchResult(prefix, List.copyOf(names), attempts, null);
    }

    public static FetchResult failure(FailedQueryRecord failure) {
        return new FetchResult(failure.getPrefix(), List.of(), failure.getAttempts(), failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * True when the page hit the result cap, so more names may exist under the prefix.
     */
    public boolean isTruncated(int maxResults) {
        return isSuccess() && names.size() >= maxResults;
    }

    public String getPrefix() {
        return prefix;
    }

    public List<String> getNames() {
        return names;
    }

    public int getAttempts() {
        return attempts;
    }

    public FailedQueryRecord getFailure() {
        return failure;
    }
}
