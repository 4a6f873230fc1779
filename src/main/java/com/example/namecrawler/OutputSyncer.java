package com.example.namecrawler;

import java.nio.file.Path;

/**
 * Receives every checkpoint and results file once it has been written locally.
 */
@FunctionalInterface
public interface OutputSyncer extends AutoCloseable {
    void enqueue(Path path);

    @Override
    default void close() {
        // no-op
    }

    static OutputSyncer noop() {
        return path -> {
        };
    }
}
