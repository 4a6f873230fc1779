package com.example.namecrawler;

public record ChildPrefix(
        String prefix,
        int priority
) {
}
