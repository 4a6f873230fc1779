package com.example.namecrawler;

import com.example.namecrawler.model.CheckpointRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

public final class CheckpointManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointManager.class);

    private final ObjectMapper mapper;
    private final Path checkpointPath;
    private final Path tempPath;

    /**
     * Manages persistence of crawl checkpoints to a single JSON file.
     */
    public CheckpointManager(Path checkpointPath) {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.checkpointPath = checkpointPath;
        this.tempPath = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".tmp");
    }

    /**
     * Returns the last saved checkpoint if the checkpoint file exists.
     */
    public Optional<CheckpointRecord> load() throws IOException {
        if (!Files.exists(checkpointPath)) {
            return Optional.empty();
        }
        try (BufferedReader reader = Files.newBufferedReader(checkpointPath)) {
            return Optional.of(mapper.readValue(reader, CheckpointRecord.class));
        }
    }

    /**
     * Writes the checkpoint to a temporary file and moves it over the previous one, so a
     * crash mid-write leaves the last good checkpoint intact. A failed write is retried once.
     *
     * @throws CheckpointStorageException if the retry fails as well
     */
    public void save(CheckpointRecord record) throws CheckpointStorageException {
        try {
            write(record);
        } catch (IOException first) {
            LOGGER.warn("Checkpoint write to {} failed; retrying once", checkpointPath, first);
            try {
                write(record);
            } catch (IOException second) {
                second.addSuppressed(first);
                throw new CheckpointStorageException("Checkpoint could not be written to " + checkpointPath, second);
            }
        }
    }

    private void write(CheckpointRecord record) throws IOException {
        Path parent = checkpointPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(tempPath.toFile(), record);
        try {
            Files.move(tempPath, checkpointPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(tempPath, checkpointPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Exposes the underlying checkpoint file path.
     */
    public Path path() {
        return checkpointPath;
    }
}
