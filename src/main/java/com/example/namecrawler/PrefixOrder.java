package com.example.namecrawler;

import java.util.Comparator;

final class PrefixOrder {
    static final Comparator<String> BY_LENGTH_THEN_VALUE = Comparator
            .comparingInt(String::length)
            .thenComparing(Comparator.naturalOrder());

    private PrefixOrder() {
    }
}
