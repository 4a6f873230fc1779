package com.example.namecrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which prefixes to query next from one sorted, possibly truncated page.
 * <p>
 * A page shorter than the cap is complete. A full page is treated as truncated: the
 * character after the prefix in the page's last name (the pivot) is followed first, and
 * only characters sorting after the pivot are queued as siblings. Everything below the
 * pivot is already on the page.
 */
public final class PrefixExpander {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrefixExpander.class);
    static final int SIBLING_OFFSET = 5;
    static final int SPECIAL_SIBLING_OFFSET = 10;

    private final PrefixAlphabet alphabet;

    public PrefixExpander(PrefixAlphabet alphabet) {
        this.alphabet = alphabet;
    }

    public Expansion expand(String prefix, List<String> suggestions, int maxResults) {
        List<String> names = List.copyOf(suggestions);
        if (suggestions.size() < maxResults) {
            return new Expansion(names, List.of());
        }

        int depth = prefix.length();
        String lastName = suggestions.get(suggestions.size() - 1);
        if (lastName.length() > depth && lastName.startsWith(prefix)) {
            char pivot = lastName.charAt(depth);
            if (alphabet.contains(pivot)) {
                return new Expansion(names, pivotChildren(prefix, pivot));
            }
            LOGGER.warn("Pivot '{}' after prefix '{}' is outside the alphabet; enumerating every branch", pivot, prefix);
        } else if (lastName.length() > depth) {
            LOGGER.warn("Last suggestion '{}' does not extend prefix '{}'; enumerating every branch", lastName, prefix);
        }
        return new Expansion(names, allChildren(prefix));
    }

    private List<ChildPrefix> pivotChildren(String prefix, char pivot) {
        int depth = prefix.length();
        List<ChildPrefix> children = new ArrayList<>();
        children.add(new ChildPrefix(prefix + pivot, depth));
        for (char c : alphabet.charactersAfter(pivot)) {
            int offset = alphabet.isPrimary(c) ? SIBLING_OFFSET : SPECIAL_SIBLING_OFFSET;
            children.add(new ChildPrefix(prefix + c, depth + offset));
        }
        return children;
    }

    private List<ChildPrefix> allChildren(String prefix) {
        int priority = prefix.length() + SIBLING_OFFSET;
        List<ChildPrefix> children = new ArrayList<>(alphabet.size());
        for (char c : alphabet.characters()) {
            children.add(new ChildPrefix(prefix + c, priority));
        }
        return children;
    }
}
