package com.example.namecrawler;

import com.example.namecrawler.model.CrawlResults;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ResultsWriterTest {
    @Test
    void writesSortedNamesWithTotals() throws Exception {
        Path dir = Files.createTempDirectory("results-test");
        Path file = dir.resolve("out").resolve("names.json");
        List<Path> synced = new ArrayList<>();
        ResultsWriter writer = new ResultsWriter(new ObjectMapper(), file, synced::add);

        writer.write(CrawlResults.of(12, List.of("aa", "ab", "b")));

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertEquals(12, root.get("total_requests").asLong());
        assertEquals(3, root.get("total_names").asInt());
        assertEquals(List.of("aa", "ab", "b"), new ObjectMapper().convertValue(root.get("names"), List.class));
        assertFalse(Files.exists(dir.resolve("out").resolve("names.json.tmp")));
        assertEquals(List.of(file), synced);
    }

    @Test
    void replacesEarlierResults() throws Exception {
        Path file = Files.createTempDirectory("results-test").resolve("names.json");
        ResultsWriter writer = new ResultsWriter(file);

        writer.write(CrawlResults.of(1, List.of("a")));
        writer.write(CrawlResults.of(2, List.of()));

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertEquals(0, root.get("total_names").asInt());
        assertEquals(0, root.get("names").size());
    }
}
