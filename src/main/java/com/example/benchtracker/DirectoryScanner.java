package com.example.benchtracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finds benchmark run directories under a root. Run directories are named
 * {@code YYYY-MM-DD[-HH-MM-SS]--label}, so sorting names also sorts them by start time.
 */
public final class DirectoryScanner {
    public static final Path DEFAULT_ROOT = Path.of("tmp.benchmarks");
    private static final Pattern RUN_DIRECTORY_NAME =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}(-\\d{2}-\\d{2}-\\d{2})?--.+");
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryScanner.class);

    private final Path root;

    public DirectoryScanner(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public static boolean isRunDirectoryName(String name) {
        return RUN_DIRECTORY_NAME.matcher(name).matches();
    }

    /**
     * Every directory that follows the naming convention, newest first, ready or not.
     */
    public List<RunDirectory> listCandidates() {
        if (!Files.isDirectory(root)) {
            LOGGER.debug("Benchmark root {} does not exist", root.toAbsolutePath());
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(root)) {
            return dirs.filter(Files::isDirectory)
                    .filter(dir -> isRunDirectoryName(dir.getFileName().toString()))
                    .map(RunDirectory::of)
                    .sorted(Comparator.comparing(RunDirectory::name).reversed())
                    .toList();
        } catch (IOException ex) {
            LOGGER.warn("Failed to scan benchmark root {}: {}", root, ex.getMessage());
            return List.of();
        }
    }

    /**
     * The newest run directory whose tracker state has been written. A directory that exists but
     * has no state file yet is still being set up and is passed over.
     */
    public Optional<RunDirectory> findLatest() {
        for (RunDirectory candidate : listCandidates()) {
            if (isReady(candidate)) {
                return Optional.of(candidate);
            }
            LOGGER.debug("Skipping {}: no tracker state yet", candidate.name());
        }
        return Optional.empty();
    }

    static boolean isReady(RunDirectory candidate) {
        Path trackerDirectory = candidate.trackerDirectory();
        if (!Files.isDirectory(trackerDirectory) || !Files.isReadable(trackerDirectory)) {
            return false;
        }
        try (Stream<Path> files = Files.list(trackerDirectory)) {
            return files.anyMatch(file -> TrackerStore.isStateFile(file) && Files.isReadable(file) && hasContent(file));
        } catch (IOException ex) {
            LOGGER.debug("Cannot list {}: {}", trackerDirectory, ex.getMessage());
            return false;
        }
    }

    private static boolean hasContent(Path file) {
        try {
            return Files.size(file) > 0;
        } catch (IOException ex) {
            return false;
        }
    }
}
