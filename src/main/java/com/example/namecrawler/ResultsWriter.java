package com.example.namecrawler;

import com.example.namecrawler.model.CrawlResults;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the sorted name list, going through a temporary file so an interrupted write
 * never leaves a truncated results file behind.
 */
public class ResultsWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultsWriter.class);

    private final ObjectMapper mapper;
    private final Path resultsFile;
    private final OutputSyncer syncer;

    public ResultsWriter(ObjectMapper mapper, Path resultsFile, OutputSyncer syncer) {
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.resultsFile = resultsFile;
        this.syncer = syncer == null ? OutputSyncer.noop() : syncer;
    }

    public ResultsWriter(Path resultsFile) {
        this(null, resultsFile, OutputSyncer.noop());
    }

    public void write(CrawlResults results) throws IOException {
        Path parent = resultsFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = resultsFile.resolveSibling(resultsFile.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), results);
        try {
            Files.move(temp, resultsFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, resultsFile, StandardCopyOption.REPLACE_EXISTING);
        }
        LOGGER.info("Results saved to {} ({} names)", resultsFile, results.totalNames());
        syncer.enqueue(resultsFile);
    }

    public Path path() {
        return resultsFile;
    }
}
