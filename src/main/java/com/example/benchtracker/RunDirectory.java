package com.example.benchtracker;

import java.nio.file.Path;

/**
 * A timestamp-named benchmark output directory and its tracker subdirectory.
 */
public record RunDirectory(
        Path path,
        String name
) {
    public static RunDirectory of(Path path) {
        return new RunDirectory(path, path.getFileName().toString());
    }

    public Path trackerDirectory() {
        return TrackerStore.trackerDirectory(path);
    }

    public TrackerStore store() {
        return new TrackerStore(trackerDirectory());
    }

    /**
     * True if this directory's name sorts after {@code other}, meaning it was started later.
     */
    public boolean isNewerThan(RunDirectory other) {
        return other == null || name.compareTo(other.name) > 0;
    }
}
