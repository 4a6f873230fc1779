package com.example.namecrawler;

import java.util.List;

/**
 * Populates a fresh {@link Frontier} at the start of a run.
 */
public final class FrontierSeeder {
    static final int PRIMARY_SEED_PRIORITY = 1;
    static final int SPECIAL_SEED_PRIORITY = 2;

    private final PrefixAlphabet alphabet;

    public FrontierSeeder(PrefixAlphabet alphabet) {
        this.alphabet = alphabet;
    }

    /**
     * Queues every single-character prefix, primary characters ahead of special ones.
     */
    public int seed(Frontier frontier) {
        int queued = 0;
        for (char c : alphabet.primaryCharacters()) {
            if (frontier.push(String.valueOf(c), PRIMARY_SEED_PRIORITY)) {
                queued++;
            }
        }
        for (char c : alphabet.specialCharacters()) {
            if (frontier.push(String.valueOf(c), SPECIAL_SEED_PRIORITY)) {
                queued++;
            }
        }
        return queued;
    }

    /**
     * Approximates the frontier of an interrupted run: every one-character extension of an
     * explored prefix that is not itself explored, at a priority taken from its length.
     * The finer ordering of the interrupted run is lost; re-querying those prefixes restores
     * the branch structure.
     */
    public int rebuild(Frontier frontier, ExploredPrefixes explored) {
        int queued = 0;
        List<String> prefixes = explored.snapshot();
        for (String prefix : prefixes) {
            int priority = prefix.length() + 1;
            for (char c : alphabet.characters()) {
                String extension = prefix + c;
                if (!explored.contains(extension) && frontier.push(extension, priority)) {
                    queued++;
                }
            }
        }
        return queued;
    }
}
