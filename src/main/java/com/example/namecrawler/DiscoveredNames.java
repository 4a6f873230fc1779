package com.example.namecrawler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Names returned by the autocomplete service during a crawl. The set only grows.
 */
public final class DiscoveredNames {
    private final Set<String> names = ConcurrentHashMap.newKeySet();

    public DiscoveredNames() {
    }

    public DiscoveredNames(Collection<String> restored) {
        names.addAll(restored);
    }

    /**
     * Adds every name and returns how many were not seen before.
     */
    public int addAll(Collection<String> batch) {
        int added = 0;
        for (String name : batch) {
            if (names.add(name)) {
                added++;
            }
        }
        return added;
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public int size() {
        return names.size();
    }

    public List<String> sortedSnapshot() {
        List<String> sorted = new ArrayList<>(names);
        Collections.sort(sorted);
        return sorted;
    }
}
