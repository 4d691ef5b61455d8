package com.example.benchtracker;

import com.example.benchtracker.model.BenchmarkReport;
import com.example.benchtracker.model.ExerciseSnapshot;
import com.example.benchtracker.model.RunSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Persists run snapshots as JSON files inside one tracker directory.
 *
 * <p>Every write goes to a sibling temp file first and is then renamed over the target, so a
 * reader in another process sees either the previous complete file or the new one. Files that
 * must never be replaced (the first state of a run, reports) are published with a hard link,
 * which fails if the target already exists, even when another process races for it. Concurrent
 * saves of the same run must be serialized by the caller; {@link BenchmarkTracker} does this.
 */
public final class TrackerStore {
    public static final String TRACKER_DIRECTORY = ".tracker";
    static final String REPORT_PREFIX = "report_";
    private static final String STATE_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackerStore.class);

    private final ObjectMapper mapper;
    private final Path directory;

    public TrackerStore(Path directory) {
        this(directory, JsonSupport.newMapper());
    }

    TrackerStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    /**
     * Returns a store for the tracker directory owned by a benchmark run directory.
     */
    public static TrackerStore forRunDirectory(Path runDirectory) {
        return new TrackerStore(trackerDirectory(runDirectory));
    }

    public static Path trackerDirectory(Path runDirectory) {
        return runDirectory.resolve(TRACKER_DIRECTORY);
    }

    public Path directory() {
        return directory;
    }

    public Path stateFile(String runId) {
        return directory.resolve(runId + STATE_SUFFIX);
    }

    public Path reportFile(String runId) {
        return directory.resolve(REPORT_PREFIX + runId + STATE_SUFFIX);
    }

    public boolean exists(String runId) {
        return Files.exists(stateFile(runId));
    }

    /**
     * Writes the first snapshot of a run, claiming its run id in this directory.
     *
     * @throws TrackerConfigurationException if state for the run already exists
     */
    public void create(RunSnapshot snapshot) throws PersistenceException {
        Path target = stateFile(snapshot.runId());
        if (!writeOnce(target, snapshot)) {
            throw new TrackerConfigurationException("State already exists for run " + snapshot.runId() + ": " + target);
        }
        LOGGER.debug("Created state for run {}", snapshot.runId());
    }

    /**
     * Writes the full snapshot, replacing the previous state file atomically.
     */
    public void save(RunSnapshot snapshot) throws PersistenceException {
        Path target = stateFile(snapshot.runId());
        writeAtomically(target, snapshot);
        LOGGER.debug("Saved state for run {} ({} exercises)", snapshot.runId(), snapshot.exercises().size());
    }

    /**
     * Reads the snapshot for a run. An absent file means the run has not started yet and yields
     * an empty result; anything unreadable or invalid raises a retryable {@link PersistenceException}.
     */
    public Optional<RunSnapshot> load(String runId) throws PersistenceException {
        return read(stateFile(runId));
    }

    /**
     * Reads the most recently written state file in this directory, whatever its run id.
     */
    public Optional<RunSnapshot> loadLatest() throws PersistenceException {
        List<Path> files = stateFiles();
        if (files.isEmpty()) {
            return Optional.empty();
        }
        return read(files.get(0));
    }

    /**
     * Lists the run ids that have a state file, most recently modified first.
     */
    public List<String> listRunIds() throws PersistenceException {
        List<String> runIds = new ArrayList<>();
        for (Path file : stateFiles()) {
            String name = file.getFileName().toString();
            runIds.add(name.substring(0, name.length() - STATE_SUFFIX.length()));
        }
        return runIds;
    }

    /**
     * Writes the final report next to the state file. Reports are written once; a second export
     * for the same run is refused so the first report is never replaced.
     */
    public Path exportReport(BenchmarkReport report) throws PersistenceException {
        Path target = reportFile(report.run().runId());
        if (!writeOnce(target, report)) {
            throw new TrackerConfigurationException("Report already exported for run " + report.run().runId() + ": " + target);
        }
        LOGGER.info("Exported report for run {} to {}", report.run().runId(), target);
        return target;
    }

    /**
     * Reads a previously exported report.
     */
    public Optional<BenchmarkReport> loadReport(String runId) throws PersistenceException {
        Path file = reportFile(runId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(file)) {
            return Optional.of(mapper.readValue(reader, BenchmarkReport.class));
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        } catch (IOException ex) {
            throw new PersistenceException(file, "Failed to read report", ex);
        }
    }

    private Optional<RunSnapshot> read(Path file) throws PersistenceException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        RunSnapshot snapshot;
        try (Reader reader = Files.newBufferedReader(file)) {
            snapshot = mapper.readValue(reader, RunSnapshot.class);
        } catch (NoSuchFileException ex) {
            // Removed between the existence check and the open.
            return Optional.empty();
        } catch (JsonProcessingException ex) {
            throw new PersistenceException(file, "Corrupt or unrecognized state file", ex);
        } catch (IOException ex) {
            throw new PersistenceException(file, "Failed to read state file", ex);
        }
        if (snapshot == null) {
            throw new PersistenceException(file, "State file is empty");
        }
        validate(file, snapshot);
        return Optional.of(snapshot);
    }

    private void validate(Path file, RunSnapshot snapshot) throws PersistenceException {
        if (snapshot.runId() == null || snapshot.runId().isBlank()) {
            throw new PersistenceException(file, "State file has no run_id");
        }
        if (snapshot.state() == null) {
            throw new PersistenceException(file, "State file has no state");
        }
        if (snapshot.totalExercises() < 0) {
            throw new PersistenceException(file, "State file has a negative total_exercises");
        }
        for (Map.Entry<String, ExerciseSnapshot> entry : snapshot.exercises().entrySet()) {
            ExerciseSnapshot exercise = entry.getValue();
            if (exercise == null || exercise.state() == null) {
                throw new PersistenceException(file, "Exercise " + entry.getKey() + " has no state");
            }
            if (!entry.getKey().equals(exercise.key())) {
                throw new PersistenceException(file, "Exercise key " + entry.getKey() + " does not match " + exercise.key());
            }
            if (exercise.attempts() < 0 || exercise.attempts() > exercise.maxAttempts()) {
                throw new PersistenceException(file, "Exercise " + entry.getKey() + " has "
                        + exercise.attempts() + " attempts of " + exercise.maxAttempts());
            }
        }
        if (snapshot.finishedExercises() > snapshot.totalExercises()) {
            throw new PersistenceException(file, "State file has more finished exercises than total_exercises");
        }
    }

    private List<Path> stateFiles() throws PersistenceException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(TrackerStore::isStateFile)
                    .sorted(Comparator.comparing(TrackerStore::modifiedTime).reversed())
                    .toList();
        } catch (IOException ex) {
            throw new PersistenceException(directory, "Failed to list tracker directory", ex);
        }
    }

    static boolean isStateFile(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(STATE_SUFFIX)
                && !name.startsWith(REPORT_PREFIX)
                && Files.isRegularFile(path);
    }

    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException ex) {
            return FileTime.fromMillis(0L);
        }
    }

    private void writeAtomically(Path target, Object payload) throws PersistenceException {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            Files.createDirectories(directory);
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), payload);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                LOGGER.warn("Atomic move not supported for {}, falling back to a plain move", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw new PersistenceException(target, "Failed to write", ex);
        }
    }

    /**
     * Publishes {@code payload} at {@code target} only if nothing is there yet.
     *
     * @return false if {@code target} already existed; it is left untouched
     */
    private boolean writeOnce(Path target, Object payload) throws PersistenceException {
        // Unique per writer: racing writers must not share a temp file.
        Path temp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            Files.createDirectories(directory);
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), payload);
            return link(temp, target);
        } catch (IOException ex) {
            throw new PersistenceException(target, "Failed to write", ex);
        } finally {
            deleteQuietly(temp);
        }
    }

    private static boolean link(Path temp, Path target) throws IOException {
        try {
            Files.createLink(target, temp);
        } catch (FileAlreadyExistsException ex) {
            return false;
        } catch (UnsupportedOperationException ex) {
            LOGGER.warn("Hard links not supported for {}, falling back to a plain move", target);
            try {
                Files.move(temp, target);
            } catch (FileAlreadyExistsException exists) {
                return false;
            }
        }
        return true;
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOGGER.warn("Failed to remove temp file {}", temp, ex);
        }
    }
}
