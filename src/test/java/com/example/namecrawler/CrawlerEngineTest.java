package com.example.namecrawler;

import com.example.namecrawler.model.CheckpointRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerEngineTest {
    private static final Sleeper NO_SLEEP = duration -> {
    };

    @Test
    void discoversEveryNameWithoutRepeatingQueries() throws Exception {
        SortedSet<String> names = NameFixtures.randomNames("abc", 4, 0.3, 7L);
        FakeAutocompleteService service = new FakeAutocompleteService(names);
        Path output = Files.createTempDirectory("engine-test");
        CrawlerConfig config = TestConfigs.forFakeService(output, "abc", 3, 4);

        CrawlSummary summary = engine(config, service, RequestLimiter.NO_LIMIT).run();

        assertTrue(summary.completed());
        assertEquals(names.size(), summary.totalNames());
        assertEquals(service.totalQueries(), summary.totalRequests());
        assertEquals(service.totalQueries() + 1, summary.exploredPrefixes());
        assertEquals(0, summary.abandonedQueries());
        for (String prefix : service.queriedPrefixes()) {
            assertEquals(1, service.queryCount(prefix), "prefix queried more than once: " + prefix);
        }
        assertEquals(new ArrayList<>(names), readResultNames(config.resultsFile()));
        assertTrue(Files.exists(config.checkpointFile()));
    }

    @Test
    void pageLargerThanTheNameSpaceNeedsOnlySeedQueries() throws Exception {
        FakeAutocompleteService service = new FakeAutocompleteService(List.of("aa", "ab", "b", "cab"));
        CrawlerConfig config = TestConfigs.forFakeService(Files.createTempDirectory("engine-test"), "abc", 10, 2);

        CrawlSummary summary = engine(config, service, RequestLimiter.NO_LIMIT).run();

        assertTrue(summary.completed());
        assertEquals(4, summary.totalNames());
        assertEquals(Set.of("a", "b", "c"), service.queriedPrefixes());
    }

    @Test
    void resumesAfterRequestLimitWithoutRepeatingExploredPrefixes() throws Exception {
        SortedSet<String> names = NameFixtures.randomNames("abc", 4, 0.35, 11L);
        FakeAutocompleteService service = new FakeAutocompleteService(names);
        Path output = Files.createTempDirectory("engine-test");
        CrawlerConfig config = TestConfigs.forFakeService(output, "abc", 3, 1);

        CrawlSummary first = engine(config, service, requests -> requests >= 4).run();

        assertFalse(first.completed());
        assertEquals(4, first.totalRequests());
        CheckpointRecord checkpoint = new CheckpointManager(config.checkpointFile()).load().orElseThrow();
        assertEquals(4, checkpoint.requestCount());
        assertEquals(first.totalNames(), checkpoint.discoveredNames().size());
        assertEquals(first.totalNames(), readResultNames(config.resultsFile()).size());

        CrawlSummary second = engine(config, service, RequestLimiter.NO_LIMIT).run();

        assertTrue(second.completed());
        assertEquals(names.size(), second.totalNames());
        assertEquals(service.totalQueries(), second.totalRequests());
        for (String prefix : checkpoint.exploredPrefixes()) {
            if (!prefix.isEmpty()) {
                assertEquals(1, service.queryCount(prefix), "explored prefix re-queried: " + prefix);
            }
        }
        assertEquals(new ArrayList<>(names), readResultNames(config.resultsFile()));
    }

    @Test
    void retriesServerErrorsAndStillCompletes() throws Exception {
        SortedSet<String> names = NameFixtures.randomNames("abc", 3, 0.4, 3L);
        FakeAutocompleteService service = new FakeAutocompleteService(names);
        FlakyClient flaky = new FlakyClient(service, Set.of("a", "b"), 500);
        CrawlerConfig config = TestConfigs.forFakeService(Files.createTempDirectory("engine-test"), "abc", 3, 3);

        CrawlSummary summary = engine(config, flaky, RequestLimiter.NO_LIMIT).run();

        assertTrue(summary.completed());
        assertEquals(names.size(), summary.totalNames());
        assertEquals(service.totalQueries() + 2, summary.totalRequests());
        assertEquals(0, summary.abandonedQueries());
    }

    @Test
    void abandonsPrefixOnUnexpectedStatus() throws Exception {
        FakeAutocompleteService service = new FakeAutocompleteService(List.of("a", "b", "ca", "cb"));
        AutocompleteClient client = (prefix, maxResults) -> "c".equals(prefix)
                ? new AutocompleteResponse(404, "{\"detail\": \"Not Found\"}")
                : service.query(prefix, maxResults);
        CrawlerConfig config = TestConfigs.forFakeService(Files.createTempDirectory("engine-test"), "abc", 5, 2);

        CrawlSummary summary = engine(config, client, RequestLimiter.NO_LIMIT).run();

        assertTrue(summary.completed());
        assertEquals(1, summary.abandonedQueries());
        assertEquals(List.of("a", "b"), readResultNames(config.resultsFile()));
    }

    @Test
    void stopBeforeRunPausesWithoutRequests() throws Exception {
        FakeAutocompleteService service = new FakeAutocompleteService(List.of("a", "b"));
        CrawlerConfig config = TestConfigs.forFakeService(Files.createTempDirectory("engine-test"), "ab", 5, 2);
        CrawlerEngine engine = engine(config, service, RequestLimiter.NO_LIMIT);

        engine.requestStop("test");
        CrawlSummary summary = engine.run();

        assertFalse(summary.completed());
        assertEquals(0, summary.totalRequests());
        assertEquals(0, service.totalQueries());
        assertTrue(Files.exists(config.checkpointFile()));
        assertTrue(engine.awaitFinished(Duration.ofSeconds(1)));
    }

    @Test
    void checkpointStorageFailureIsFatalButResultsAreWritten() throws Exception {
        Path output = Files.createTempDirectory("engine-test");
        Path blocker = Files.writeString(output.resolve("blocker"), "not a directory");
        FakeAutocompleteService service = new FakeAutocompleteService(List.of("a", "ab"));
        CrawlerConfig config = TestConfigs.withCheckpointFile(
                TestConfigs.forFakeService(output, "ab", 5, 1), blocker.resolve("checkpoint.json"));

        assertThrows(CheckpointStorageException.class, () -> engine(config, service, RequestLimiter.NO_LIMIT).run());

        assertEquals(List.of("a", "ab"), readResultNames(config.resultsFile()));
    }

    private CrawlerEngine engine(CrawlerConfig config, AutocompleteClient client, RequestLimiter limiter) {
        return new CrawlerEngine(config, new CheckpointManager(config.checkpointFile()), client, limiter, NO_SLEEP);
    }

    private List<String> readResultNames(Path resultsFile) throws IOException {
        JsonNode root = new ObjectMapper().readTree(resultsFile.toFile());
        List<String> result = new ArrayList<>();
        root.get("names").forEach(node -> result.add(node.asText()));
        assertEquals(result.size(), root.get("total_names").asInt());
        return result;
    }

    /**
     * Fails the first query for each listed prefix with the given status, then delegates.
     */
    private static final class FlakyClient implements AutocompleteClient {
        private final AutocompleteClient delegate;
        private final Set<String> pending = ConcurrentHashMap.newKeySet();
        private final int status;

        FlakyClient(AutocompleteClient delegate, Set<String> prefixes, int status) {
            this.delegate = delegate;
            this.pending.addAll(prefixes);
            this.status = status;
        }

        @Override
        public AutocompleteResponse query(String prefix, int maxResults) throws IOException, InterruptedException {
            if (pending.remove(prefix)) {
                return new AutocompleteResponse(status, "Internal Server Error");
            }
            return delegate.query(prefix, maxResults);
        }
    }
}
