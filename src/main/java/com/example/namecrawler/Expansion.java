package com.example.namecrawler;

import java.util.List;

/**
 * Outcome of expanding one queried prefix: names to record and child prefixes to queue,
 * children listed in the order they should be pushed.
 */
public record Expansion(
        List<String> namesToRecord,
        List<ChildPrefix> children
) {
    public boolean hasChildren() {
        return !children.isEmpty();
    }
}
