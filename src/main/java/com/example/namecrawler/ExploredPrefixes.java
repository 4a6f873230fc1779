package com.example.namecrawler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prefixes whose query has been fully processed. Entries are never removed.
 * <p>
 * The root prefix {@code ""} is always a member: the single-character seeds are its
 * expansion, so it counts as explored without ever being sent to the service.
 */
public final class ExploredPrefixes {
    public static final String ROOT = "";

    private final Set<String> prefixes = ConcurrentHashMap.newKeySet();

    public ExploredPrefixes() {
        prefixes.add(ROOT);
    }

    public ExploredPrefixes(Collection<String> restored) {
        this();
        prefixes.addAll(restored);
    }

    public boolean contains(String prefix) {
        return prefixes.contains(prefix);
    }

    /**
     * Records a prefix as explored.
     *
     * @return {@code false} if another worker already explored it
     */
    public boolean markExplored(String prefix) {
        return prefixes.add(prefix);
    }

    public int size() {
        return prefixes.size();
    }

    /**
     * Sorted copy, shortest prefixes first.
     */
    public List<String> snapshot() {
        List<String> copy = new ArrayList<>(prefixes);
        Collections.sort(copy, PrefixOrder.BY_LENGTH_THEN_VALUE);
        return copy;
    }
}
