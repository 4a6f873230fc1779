package com.example.namecrawler;

import com.example.namecrawler.model.CheckpointRecord;
import com.example.namecrawler.model.CrawlResults;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates the crawl lifecycle: checkpoint restore, a fixed pool of workers draining
 * the {@link Frontier}, periodic checkpoints, and the final checkpoint and results file.
 */
public final class CrawlerEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrawlerEngine.class);

    private final CrawlerConfig config;
    private final CheckpointManager checkpointManager;
    private final AutocompleteClient client;
    private final RequestLimiter limiter;
    private final Sleeper sleeper;
    private final Clock clock = Clock.systemUTC();
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final ReentrantLock checkpointLock = new ReentrantLock();
    private volatile Frontier activeFrontier;
    private volatile CheckpointStorageException storageFailure;

    public CrawlerEngine(CrawlerConfig config, CheckpointManager checkpointManager, AutocompleteClient client) {
        this(config, checkpointManager, client, RequestLimiter.NO_LIMIT, Sleeper.SYSTEM);
    }

    CrawlerEngine(CrawlerConfig config,
                  CheckpointManager checkpointManager,
                  AutocompleteClient client,
                  RequestLimiter limiter,
                  Sleeper sleeper) {
        this.config = config;
        this.checkpointManager = checkpointManager;
        this.client = client;
        this.limiter = limiter;
        this.sleeper = sleeper;
    }

    /**
     * Executes a crawl run. Prior checkpoint state is restored when present. The method
     * returns once the frontier is drained or a stop was requested and every in-flight
     * prefix has finished.
     *
     * @throws CheckpointStorageException if a checkpoint could not be written even after a retry
     */
    public CrawlSummary run() throws IOException, InterruptedException {
        try {
            return crawl();
        } finally {
            finished.countDown();
        }
    }

    /**
     * Asks the workers to stop after their current prefix. Safe to call from any thread.
     */
    public void requestStop(String reason) {
        if (stopRequested.compareAndSet(false, true)) {
            LOGGER.info("Stop requested ({}); finishing in-flight prefixes", reason);
        }
        Frontier frontier = activeFrontier;
        if (frontier != null) {
            frontier.wakeAll();
        }
    }

    boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Waits for {@link #run()} to return, including its final checkpoint.
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private CrawlSummary crawl() throws IOException, InterruptedException {
        Instant startedAt = clock.instant();
        PrefixAlphabet alphabet = config.alphabet();
        FrontierSeeder seeder = new FrontierSeeder(alphabet);
        Frontier frontier = new Frontier();

        Optional<CheckpointRecord> existing = checkpointManager.load();
        CrawlState state;
        if (existing.isPresent()) {
            state = CrawlState.restore(existing.get());
            int queued = seeder.rebuild(frontier, state.explored());
            LOGGER.info("Resumed from checkpoint with {} names and {} explored prefixes",
                    state.names().size(), state.explored().size());
            LOGGER.info("Queued {} prefixes for exploration", queued);
        } else {
            state = CrawlState.fresh();
            LOGGER.info("Starting fresh with {} initial prefixes", seeder.seed(frontier));
        }
        activeFrontier = frontier;

        LOGGER.info("Starting extraction with max_results={} and {} workers", config.maxResults(), config.threadCount());
        LOGGER.info("Initial delay: {} ms, min: {} ms, max: {} ms",
                config.initialDelay().toMillis(), config.minDelay().toMillis(), config.maxDelay().toMillis());
        LOGGER.info("Alphabet: {}", alphabet);

        OutputSyncer syncer = createSyncer();
        try {
            AdaptiveRateController rateController = new AdaptiveRateController(
                    config.initialDelay(), config.minDelay(), config.maxDelay());
            AutocompleteFetcher fetcher = new AutocompleteFetcher(client, rateController, config.backoffPolicy(),
                    config.maxResults(), config.requestJitter(), state.requestCount(), sleeper);
            CrawlRun run = new CrawlRun(
                    state,
                    frontier,
                    new PrefixExplorer(state, frontier, fetcher, new PrefixExpander(alphabet), config.maxResults()),
                    rateController,
                    new CheckpointTrigger(config.checkpointRequestInterval(), config.checkpointTimeInterval(),
                            clock, state.requestCount().get()),
                    syncer
            );

            StatusReporter statusReporter = new StatusReporter(state, frontier, rateController, startedAt);
            ScheduledExecutorService statusExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "crawl-status");
                thread.setDaemon(true);
                return thread;
            });
            long statusMillis = Math.max(1L, config.statusInterval().toMillis());
            statusExecutor.scheduleAtFixedRate(statusReporter, statusMillis, statusMillis, TimeUnit.MILLISECONDS);

            ExecutorService workers = Executors.newFixedThreadPool(config.threadCount());
            for (int i = 0; i < config.threadCount(); i++) {
                workers.submit(() -> runWorker(run));
            }
            workers.shutdown();
            boolean interrupted = awaitWorkers(workers);
            statusExecutor.shutdownNow();
            statusReporter.run();

            boolean completed = !stopRequested.get() && frontier.isDrained();
            CheckpointStorageException fatal = storageFailure;
            checkpointLock.lock();
            try {
                saveCheckpoint(state, syncer);
            } catch (CheckpointStorageException ex) {
                LOGGER.error("Final checkpoint could not be written", ex);
                fatal = ex;
            } finally {
                checkpointLock.unlock();
            }
            new ResultsWriter(mapper, config.resultsFile(), syncer)
                    .write(CrawlResults.of(state.requestCount().get(), state.names().sortedSnapshot()));
            if (fatal != null) {
                throw fatal;
            }

            CrawlSummary summary = new CrawlSummary(
                    completed,
                    state.requestCount().get(),
                    state.names().size(),
                    state.explored().size(),
                    state.abandonedQueries().get(),
                    Duration.between(startedAt, clock.instant())
            );
            logSummary(summary);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return summary;
        } finally {
            syncer.close();
        }
    }

    private boolean awaitWorkers(ExecutorService workers) {
        boolean interrupted = false;
        while (true) {
            try {
                if (workers.awaitTermination(1, TimeUnit.SECONDS)) {
                    return interrupted;
                }
            } catch (InterruptedException ex) {
                // Let in-flight prefixes finish so the final checkpoint is consistent.
                interrupted = true;
                requestStop("interrupted");
            }
        }
    }

    private void runWorker(CrawlRun run) {
        while (!stopRequested.get()) {
            Optional<QueueItem> next;
            try {
                next = run.frontier().pop(config.pollTimeout(), stopRequested::get);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
            if (next.isEmpty()) {
                if (run.frontier().isDrained()) {
                    LOGGER.debug("Frontier drained; worker exiting");
                    return;
                }
                continue;
            }

            QueueItem item = next.get();
            if (stopRequested.get()) {
                run.frontier().complete(item);
                return;
            }
            boolean fetched = false;
            try {
                fetched = run.explorer().explore(item.prefix());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.info("Worker interrupted while exploring '{}'", item.prefix());
                return;
            } catch (RuntimeException ex) {
                LOGGER.error("Error exploring prefix '{}'", item.prefix(), ex);
            } finally {
                run.frontier().complete(item);
            }
            if (!fetched) {
                continue;
            }

            maybeCheckpoint(run);
            long requests = run.state().requestCount().get();
            if (limiter.shouldStop(requests)) {
                requestStop("request limit reached after " + requests + " requests");
            }
            try {
                sleeper.sleep(run.rateController().delayFor(item.prefix().length()));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void maybeCheckpoint(CrawlRun run) {
        if (!run.trigger().isDue(run.state().requestCount().get()) || !checkpointLock.tryLock()) {
            return;
        }
        try {
            long requests = run.state().requestCount().get();
            if (run.trigger().isDue(requests)) {
                saveCheckpoint(run.state(), run.syncer());
                run.trigger().markSaved(requests);
            }
        } catch (CheckpointStorageException ex) {
            LOGGER.error("Checkpoint storage failed twice in a row; stopping the crawl", ex);
            storageFailure = ex;
            requestStop("checkpoint storage failure");
        } finally {
            checkpointLock.unlock();
        }
    }

    private void saveCheckpoint(CrawlState state, OutputSyncer syncer) throws CheckpointStorageException {
        CheckpointRecord record = state.toCheckpoint(clock.instant());
        checkpointManager.save(record);
        LOGGER.info("Checkpoint saved with {} names and {} explored prefixes",
                record.discoveredNames().size(), record.exploredPrefixes().size());
        syncer.enqueue(checkpointManager.path());
    }

    private OutputSyncer createSyncer() {
        if (!config.s3SyncEnabled()) {
            return OutputSyncer.noop();
        }
        return new S3SyncService(
                config.s3Bucket().orElseThrow(),
                config.s3Prefix().orElse(""),
                config.s3Region()
        );
    }

    private void logSummary(CrawlSummary summary) {
        double seconds = summary.elapsed().toMillis() / 1000.0;
        double minutes = Math.max(seconds / 60.0, 0.01);
        if (summary.completed()) {
            LOGGER.info("Extraction completed in {} seconds", String.format("%.2f", seconds));
        } else {
            LOGGER.info("Crawl paused with checkpoint after {} seconds", String.format("%.2f", seconds));
        }
        LOGGER.info("Total API requests: {}", summary.totalRequests());
        LOGGER.info("Total names discovered: {}", summary.totalNames());
        LOGGER.info("Final rate: {} names/min, efficiency {} names per request",
                String.format("%.1f", summary.totalNames() / minutes),
                String.format("%.2f", summary.namesPerRequest()));
        if (summary.abandonedQueries() > 0) {
            LOGGER.warn("{} queries were abandoned; names reachable only through them are missing",
                    summary.abandonedQueries());
        }
    }

    private record CrawlRun(
            CrawlState state,
            Frontier frontier,
            PrefixExplorer explorer,
            AdaptiveRateController rateController,
            CheckpointTrigger trigger,
            OutputSyncer syncer
    ) {
    }
}
