package com.example.namecrawler;

public record AutocompleteResponse(
        int statusCode,
        String body
) {
}
