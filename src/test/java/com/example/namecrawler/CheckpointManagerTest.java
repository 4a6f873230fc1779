package com.example.namecrawler;

import com.example.namecrawler.model.CheckpointRecord;
import com.example.namecrawler.model.LengthStatsSnapshot;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointManagerTest {
    @Test
    void restoresIdenticalNamesAndExploredPrefixes() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        CheckpointManager manager = new CheckpointManager(dir.resolve("checkpoint.json"));

        CrawlState state = CrawlState.fresh();
        state.names().addAll(List.of("delta", "alpha", "charlie"));
        state.explored().markExplored("a");
        state.explored().markExplored("al");
        state.explored().markExplored("d");
        state.lengthStats().record(1, 3);
        state.lengthStats().record(2, 0);
        state.requestCount().set(42);

        manager.save(state.toCheckpoint(Instant.ofEpochSecond(1_700_000_000L)));
        CrawlState restored = CrawlState.restore(manager.load().orElseThrow());

        assertEquals(state.names().sortedSnapshot(), restored.names().sortedSnapshot());
        assertEquals(state.explored().snapshot(), restored.explored().snapshot());
        assertEquals(42L, restored.requestCount().get());
        assertEquals(state.lengthStats().snapshot(), restored.lengthStats().snapshot());
        assertFalse(Files.exists(dir.resolve("checkpoint.json.tmp")));
    }

    @Test
    void overwritesPreviousCheckpoint() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        CheckpointManager manager = new CheckpointManager(dir.resolve("nested").resolve("checkpoint.json"));

        manager.save(new CheckpointRecord(List.of("a"), List.of("", "a"), 1, 1.0, Map.of()));
        manager.save(new CheckpointRecord(List.of("a", "ab"), List.of("", "a", "b"), 2, 2.0, Map.of()));

        CheckpointRecord loaded = manager.load().orElseThrow();
        assertEquals(List.of("a", "ab"), loaded.discoveredNames());
        assertEquals(2L, loaded.requestCount());
    }

    @Test
    void returnsEmptyWhenNoCheckpointExists() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        assertTrue(new CheckpointManager(dir.resolve("missing.json")).load().isEmpty());
    }

    @Test
    void readsSnakeCaseCheckpointFormat() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        Path file = dir.resolve("autocomplete_checkpoint.json");
        Files.writeString(file, "{\"discovered_names\": [\"aa\", \"ab\"], "
                + "\"explored_prefixes\": [\"a\"], "
                + "\"request_count\": 7, "
                + "\"timestamp\": 1700000000.25, "
                + "\"prefix_length_stats\": {\"1\": {\"success\": 1, \"queries\": 1}}}");

        CheckpointRecord record = new CheckpointManager(file).load().orElseThrow();

        assertEquals(List.of("aa", "ab"), record.discoveredNames());
        assertEquals(List.of("a"), record.exploredPrefixes());
        assertEquals(7L, record.requestCount());
        assertEquals(1700000000.25, record.timestamp());
        assertEquals(new LengthStatsSnapshot(1, 1), record.prefixLengthStats().get(1));
    }

    @Test
    void writesSnakeCaseFieldNames() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        Path file = dir.resolve("checkpoint.json");
        new CheckpointManager(file).save(new CheckpointRecord(List.of("x"), List.of(""), 3, 5.5,
                Map.of(1, new LengthStatsSnapshot(1, 2))));

        String json = Files.readString(file);
        assertTrue(json.contains("\"discovered_names\""));
        assertTrue(json.contains("\"explored_prefixes\""));
        assertTrue(json.contains("\"request_count\":3"));
        assertTrue(json.contains("\"prefix_length_stats\":{\"1\":{\"success\":1,\"queries\":2}}"));
    }

    @Test
    void surfacesFailureWhenRetryAlsoFails() throws Exception {
        Path blocker = Files.createTempFile("checkpoint-blocker", ".txt");
        CheckpointManager manager = new CheckpointManager(blocker.resolve("checkpoint.json"));

        assertThrows(CheckpointStorageException.class,
                () -> manager.save(new CheckpointRecord(List.of(), List.of(), 0, 0.0, Map.of())));
    }
}
