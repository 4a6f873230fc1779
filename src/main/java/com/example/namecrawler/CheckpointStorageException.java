package com.example.namecrawler;

import java.io.IOException;

/**
 * A checkpoint could not be written even after a retry. The crawl cannot promise
 * restartability past this point.
 */
public class CheckpointStorageException extends IOException {
    public CheckpointStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
