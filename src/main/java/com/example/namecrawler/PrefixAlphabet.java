package com.example.namecrawler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of characters a prefix can be extended with.
 * <p>
 * Characters are enumerated in declared order, primary characters first. Ordering
 * comparisons against a pivot use the character's code point, which is how the
 * backend sorts its suggestions.
 */
public final class PrefixAlphabet {
    public static final String DEFAULT_PRIMARY = "0123456789abcdefghijklmnopqrstuvwxyz";
    public static final String DEFAULT_SPECIAL = "!#$%&()*+,-./:;<=>?@[]^_`{|}~";

    private final List<Character> characters;
    private final Set<Character> primary;
    private final Set<Character> special;

    private PrefixAlphabet(Set<Character> primary, Set<Character> special) {
        this.primary = Collections.unmodifiableSet(primary);
        this.special = Collections.unmodifiableSet(special);
        List<Character> all = new ArrayList<>(primary);
        all.addAll(special);
        this.characters = List.copyOf(all);
    }

    public static PrefixAlphabet defaults() {
        return of(DEFAULT_PRIMARY, DEFAULT_SPECIAL);
    }

    public static PrefixAlphabet of(String primaryCharacters, String specialCharacters) {
        Set<Character> primary = toOrderedSet(primaryCharacters, "primaryCharacters");
        Set<Character> special = toOrderedSet(specialCharacters, "specialCharacters");
        for (Character c : special) {
            if (primary.contains(c)) {
                throw new IllegalArgumentException("Character '" + c + "' is both primary and special.");
            }
        }
        if (primary.isEmpty() && special.isEmpty()) {
            throw new IllegalArgumentException("Alphabet must contain at least one character.");
        }
        return new PrefixAlphabet(primary, special);
    }

    private static Set<Character> toOrderedSet(String value, String field) {
        Set<Character> result = new LinkedHashSet<>();
        if (value == null) {
            return result;
        }
        for (char c : value.toCharArray()) {
            if (!result.add(c)) {
                throw new IllegalArgumentException(field + " lists '" + c + "' more than once.");
            }
        }
        return result;
    }

    public boolean contains(char c) {
        return primary.contains(c) || special.contains(c);
    }

    public boolean isPrimary(char c) {
        return primary.contains(c);
    }

    /**
     * All characters in enumeration order.
     */
    public List<Character> characters() {
        return characters;
    }

    public Set<Character> primaryCharacters() {
        return primary;
    }

    public Set<Character> specialCharacters() {
        return special;
    }

    /**
     * Characters that sort strictly after {@code pivot}, in enumeration order.
     */
    public List<Character> charactersAfter(char pivot) {
        List<Character> result = new ArrayList<>();
        for (Character c : characters) {
            if (c > pivot) {
                result.add(c);
            }
        }
        return result;
    }

    public int size() {
        return characters.size();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(characters.size());
        characters.forEach(builder::append);
        return builder.toString();
    }
}
