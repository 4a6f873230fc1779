package com.example.namecrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Mirrors checkpoint and results files to S3 from a background thread, so a crawl host
 * can be lost without losing the restartable state.
 * <p>
 * The file is read when it is enqueued. Writes that pile up behind a slow upload collapse
 * into one: only the newest content of each file name is sent.
 */
public final class S3SyncService implements OutputSyncer {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3SyncService.class);
    private final BlockingQueue<SyncTask> queue = new LinkedBlockingQueue<>();
    private final Map<String, byte[]> pending = new ConcurrentHashMap<>();
    private final S3Client s3Client;
    private final Thread worker;
    private final String bucket;
    private final String prefix;
    private volatile boolean closed;

    public S3SyncService(String bucket, String prefix, Optional<String> region) {
        this(region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).build())
                .orElseGet(() -> S3Client.builder().build()), bucket, prefix);
    }

    S3SyncService(S3Client s3Client, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = normalizePrefix(prefix);
        this.worker = new Thread(this::run, "s3-sync");
        this.worker.start();
    }

    @Override
    public void enqueue(Path path) {
        if (closed) {
            LOGGER.warn("Skipping S3 sync for {} because the sync service is closed.", path);
            return;
        }
        String fileName = path.getFileName().toString();
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException ex) {
            LOGGER.warn("Failed to read {} for S3 sync", path, ex);
            return;
        }
        if (pending.put(fileName, content) == null) {
            queue.offer(new SyncTask(fileName));
        } else {
            LOGGER.debug("Replaced queued S3 upload of {} with newer content", fileName);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.offer(SyncTask.poisonPill());
        try {
            worker.join();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for S3 sync worker to stop.", ex);
        } finally {
            s3Client.close();
        }
    }

    private void run() {
        try {
            while (true) {
                SyncTask task = queue.take();
                if (task.poison()) {
                    return;
                }
                byte[] content = pending.remove(task.fileName());
                if (content != null) {
                    upload(task.fileName(), content);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("S3 sync worker interrupted; exiting.", ex);
        }
    }

    private void upload(String fileName, byte[] content) {
        String key = prefix.isEmpty() ? fileName : prefix + "/" + fileName;
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType("application/json")
                    .build();
            s3Client.putObject(request, RequestBody.fromBytes(content));
            LOGGER.info("Uploaded {} ({} bytes) to s3://{}/{}", fileName, content.length, bucket, key);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to upload {} to S3", fileName, ex);
        }
    }

    private String normalizePrefix(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("/+$", "");
    }

    private record SyncTask(String fileName, boolean poison) {
        private SyncTask(String fileName) {
            this(fileName, false);
        }

        private static SyncTask poisonPill() {
            return new SyncTask(null, true);
        }
    }
}
