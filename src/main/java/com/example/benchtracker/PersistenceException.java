package com.example.benchtracker;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a state or report file cannot be written, read, parsed or validated.
 * The condition may be transient, so callers are expected to retry.
 */
public class PersistenceException extends IOException {
    private final Path path;

    public PersistenceException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public PersistenceException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
