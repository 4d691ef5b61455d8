package com.example.benchtracker;

import com.example.benchtracker.model.ExerciseSnapshot;
import com.example.benchtracker.model.ExerciseState;
import com.example.benchtracker.model.Progress;
import com.example.benchtracker.model.RunSnapshot;
import com.example.benchtracker.model.RunState;
import com.example.benchtracker.model.StatisticsSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative in-memory state of one benchmark run and the API workers use to move it through
 * its lifecycle. One tracker is created per run and shared by reference with every worker.
 *
 * <p>All mutations go through a single lock that guards the run fields, the exercise map and the
 * cached statistics. Apart from the first write of {@link #startRun}, the lock is held only for
 * the metadata update itself. The resulting snapshot
 * is written to the {@link TrackerStore} after the lock is released; writes are ordered by a
 * version number so an older snapshot never replaces a newer one on disk.
 *
 * <p>Lifecycle misuse raises {@link TrackerConfigurationException}. A failed write raises
 * {@link PersistenceException} after the in-memory change has been applied; {@link #flush()}
 * retries it.
 */
public final class BenchmarkTracker {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final Logger LOGGER = LoggerFactory.getLogger(BenchmarkTracker.class);

    private final TrackerStore store;
    private final Clock clock;
    private final ObjectMapper mapper = JsonSupport.newMapper();
    private final Object lock = new Object();
    private final Object writeLock = new Object();

    // Guarded by lock.
    private String runId;
    private String model;
    private List<String> languages = List.of();
    private int totalExercises;
    private RunState state;
    private Instant startedAt;
    private Instant completedAt;
    private Double durationSeconds;
    private String currentExercise;
    private Map<String, Object> config = Map.of();
    private final Map<String, ExerciseRecord> exercises = new LinkedHashMap<>();
    private final Map<String, ExerciseSnapshot> published = new LinkedHashMap<>();
    private StatisticsEngine statistics;
    private long version;

    // Guarded by writeLock.
    private long persistedVersion;

    public BenchmarkTracker(TrackerStore store) {
        this(store, Clock.systemUTC());
    }

    public BenchmarkTracker(TrackerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Rebuilds a tracker from the persisted state of a run, including its cached statistics.
     * Returns empty when the store has no state for {@code runId}.
     */
    public static Optional<BenchmarkTracker> restore(TrackerStore store, String runId) throws PersistenceException {
        return restore(store, runId, Clock.systemUTC());
    }

    static Optional<BenchmarkTracker> restore(TrackerStore store, String runId, Clock clock) throws PersistenceException {
        Optional<RunSnapshot> existing = store.load(runId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        RunSnapshot snapshot = existing.get();
        BenchmarkTracker tracker = new BenchmarkTracker(store, clock);
        synchronized (tracker.lock) {
            tracker.runId = snapshot.runId();
            tracker.model = snapshot.model();
            tracker.languages = snapshot.languages();
            tracker.totalExercises = snapshot.totalExercises();
            tracker.state = snapshot.state();
            tracker.startedAt = snapshot.startedAt();
            tracker.completedAt = snapshot.completedAt();
            tracker.durationSeconds = snapshot.durationSeconds();
            tracker.currentExercise = snapshot.currentExercise();
            tracker.config = snapshot.config();
            tracker.statistics = new StatisticsEngine(snapshot.totalExercises(), snapshot.languages());
            for (ExerciseSnapshot exercise : snapshot.exercises().values()) {
                tracker.exercises.put(exercise.key(), ExerciseRecord.restore(exercise));
                tracker.published.put(exercise.key(), exercise);
                tracker.statistics.exerciseAdded(exercise.language());
                if (exercise.state().isTerminal()) {
                    tracker.statistics.exerciseFinished(exercise);
                }
            }
        }
        LOGGER.info("Restored run {} in state {} with {} exercises",
                snapshot.runId(), snapshot.state().value(), snapshot.exercises().size());
        return Optional.of(tracker);
    }

    public RunSnapshot startRun(String runId, String model, List<String> languages, int totalExercises)
            throws PersistenceException {
        return startRun(runId, model, languages, totalExercises, Map.of());
    }

    /**
     * Creates the run, moves it from INITIALIZING to RUNNING and persists the first snapshot.
     * The first write claims {@code runId} in the store, so of several trackers starting the same
     * run on one directory, in this process or another, only one succeeds.
     *
     * <p>Run ids starting with {@code report_} are reserved for exported reports.
     *
     * @throws TrackerConfigurationException if this tracker already holds a run or the store
     *                                       already has state for {@code runId}
     */
    public RunSnapshot startRun(String runId,
                                String model,
                                List<String> languages,
                                int totalExercises,
                                Map<String, ?> config) throws PersistenceException {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        if (runId.startsWith(TrackerStore.REPORT_PREFIX)) {
            throw new IllegalArgumentException("runId must not start with " + TrackerStore.REPORT_PREFIX + ": " + runId);
        }
        if (totalExercises < 0) {
            throw new IllegalArgumentException("totalExercises must not be negative: " + totalExercises);
        }
        Map<String, Object> normalizedConfig = Collections.unmodifiableMap(JsonSupport.normalize(mapper, config));
        RunSnapshot snapshot;
        long snapshotVersion;
        synchronized (lock) {
            if (this.runId != null) {
                throw new TrackerConfigurationException("Tracker already holds run " + this.runId);
            }
            if (store.exists(runId)) {
                throw new TrackerConfigurationException("State already exists for run " + runId + ": " + store.stateFile(runId));
            }
            this.runId = runId;
            this.model = model;
            this.languages = List.copyOf(new LinkedHashSet<>(languages == null ? List.of() : languages));
            this.totalExercises = totalExercises;
            this.config = normalizedConfig;
            this.state = RunState.INITIALIZING;
            this.startedAt = clock.instant();
            this.statistics = new StatisticsEngine(totalExercises, this.languages);
            transitionLocked(RunState.RUNNING);
            snapshot = snapshotLocked();
            snapshotVersion = ++version;
            synchronized (writeLock) {
                try {
                    store.create(snapshot);
                } catch (TrackerConfigurationException ex) {
                    clearRunLocked();
                    throw ex;
                }
                persistedVersion = snapshotVersion;
            }
        }
        LOGGER.info("Started benchmark run {} (model={}, languages={}, exercises={})",
                runId, model, snapshot.languages(), totalExercises);
        return snapshot;
    }

    public void startExercise(String name, String language) throws PersistenceException {
        startExercise(name, language, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Starts an attempt at an exercise. Calling this again while the exercise is still running
     * records a retry on the same entry, up to {@code maxAttempts} attempts in total.
     */
    public void startExercise(String name, String language, int maxAttempts) throws PersistenceException {
        requireName(name, language);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        String key = ExerciseSnapshot.key(language, name);
        RunSnapshot snapshot;
        long snapshotVersion;
        int attempt;
        int allowed;
        synchronized (lock) {
            requireRunLocked();
            if (state != RunState.RUNNING) {
                throw new TrackerConfigurationException("Cannot start exercise " + key + ": run " + runId + " is " + state.value());
            }
            ExerciseRecord record = exercises.get(key);
            if (record == null) {
                if (exercises.size() >= totalExercises) {
                    throw new TrackerConfigurationException("Cannot start exercise " + key + ": run " + runId
                            + " already tracks all " + totalExercises + " exercises");
                }
                record = new ExerciseRecord(name, language, maxAttempts);
                exercises.put(key, record);
                statistics.exerciseAdded(language);
            } else if (record.state().isTerminal()) {
                throw new TrackerConfigurationException("Exercise " + key + " already finished as " + record.state().value());
            } else if (record.state() == ExerciseState.RUNNING && record.attempts() >= record.maxAttempts()) {
                throw new TrackerConfigurationException("Exercise " + key + " has used all " + record.maxAttempts() + " attempts");
            }
            record.beginAttempt(clock.instant(), maxAttempts);
            attempt = record.attempts();
            allowed = record.maxAttempts();
            currentExercise = key;
            publishLocked(record);
            snapshot = snapshotLocked();
            snapshotVersion = ++version;
        }
        LOGGER.info("Started exercise {} (attempt {}/{})", key, attempt, allowed);
        persist(snapshotVersion, snapshot);
    }

    public void completeExercise(String name, String language, boolean passed, Map<String, ?> metrics)
            throws PersistenceException {
        completeExercise(name, language, passed, null, metrics);
    }

    /**
     * Records the outcome of the running attempt and merges {@code metrics} into the exercise.
     * The metric map is stored as given; only its JSON form is kept.
     *
     * @throws TrackerConfigurationException if the exercise is not currently running, which
     *                                       includes never having been started
     */
    public void completeExercise(String name,
                                 String language,
                                 boolean passed,
                                 String errorMessage,
                                 Map<String, ?> metrics) throws PersistenceException {
        finishExercise(name, language, passed ? ExerciseState.PASSED : ExerciseState.FAILED, errorMessage, metrics);
    }

    /**
     * Marks a running exercise as ERROR: the attempt could not be evaluated at all.
     */
    public void recordExerciseError(String name, String language, String errorMessage, Map<String, ?> metrics)
            throws PersistenceException {
        finishExercise(name, language, ExerciseState.ERROR, errorMessage, metrics);
    }

    /**
     * Marks an exercise as SKIPPED, whether or not it was started.
     */
    public void skipExercise(String name, String language, String reason) throws PersistenceException {
        requireName(name, language);
        String key = ExerciseSnapshot.key(language, name);
        RunSnapshot snapshot;
        long snapshotVersion;
        synchronized (lock) {
            requireActiveRunLocked(key);
            ExerciseRecord record = exercises.get(key);
            if (record == null) {
                if (exercises.size() >= totalExercises) {
                    throw new TrackerConfigurationException("Cannot skip exercise " + key + ": run " + runId
                            + " already tracks all " + totalExercises + " exercises");
                }
                record = new ExerciseRecord(name, language, DEFAULT_MAX_ATTEMPTS);
                exercises.put(key, record);
                statistics.exerciseAdded(language);
            } else if (record.state().isTerminal()) {
                throw new TrackerConfigurationException("Exercise " + key + " already finished as " + record.state().value());
            }
            snapshot = recordOutcomeLocked(record, ExerciseState.SKIPPED, Map.of(), reason);
            snapshotVersion = ++version;
        }
        LOGGER.info("Skipped exercise {}{}", key, reason == null ? "" : ": " + reason);
        persist(snapshotVersion, snapshot);
    }

    private void finishExercise(String name,
                                String language,
                                ExerciseState outcome,
                                String errorMessage,
                                Map<String, ?> metrics) throws PersistenceException {
        requireName(name, language);
        String key = ExerciseSnapshot.key(language, name);
        Map<String, Object> normalized = JsonSupport.normalize(mapper, metrics);
        RunSnapshot snapshot;
        long snapshotVersion;
        synchronized (lock) {
            requireActiveRunLocked(key);
            ExerciseRecord record = exercises.get(key);
            if (record == null) {
                throw new TrackerConfigurationException("Exercise " + key + " was never started in run " + runId);
            }
            if (record.state() != ExerciseState.RUNNING) {
                throw new TrackerConfigurationException("Exercise " + key + " is not running (state "
                        + record.state().value() + ")");
            }
            snapshot = recordOutcomeLocked(record, outcome, normalized, errorMessage);
            snapshotVersion = ++version;
        }
        LOGGER.info("Completed exercise {} - {}", key, outcome.name());
        persist(snapshotVersion, snapshot);
    }

    private RunSnapshot recordOutcomeLocked(ExerciseRecord record,
                                            ExerciseState outcome,
                                            Map<String, Object> metrics,
                                            String message) {
        record.finish(outcome, clock.instant(), metrics, message);
        ExerciseSnapshot finished = publishLocked(record);
        statistics.exerciseFinished(finished);
        if (record.key().equals(currentExercise)) {
            currentExercise = null;
        }
        if (statistics.completed() >= totalExercises && !state.isTerminal()) {
            LOGGER.info("All {} exercises of run {} finished", totalExercises, runId);
            transitionLocked(RunState.COMPLETED);
        }
        return snapshotLocked();
    }

    public void pause() throws PersistenceException {
        changeState(RunState.PAUSED);
    }

    public void resume() throws PersistenceException {
        changeState(RunState.RUNNING);
    }

    /**
     * Ends the run in a terminal state, recording its completion time and duration.
     */
    public void finish(RunState outcome) throws PersistenceException {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal run state: " + outcome.value());
        }
        changeState(outcome);
    }

    private void changeState(RunState target) throws PersistenceException {
        RunSnapshot snapshot;
        long snapshotVersion;
        synchronized (lock) {
            requireRunLocked();
            transitionLocked(target);
            snapshot = snapshotLocked();
            snapshotVersion = ++version;
        }
        persist(snapshotVersion, snapshot);
    }

    // Undoes a start whose run id was claimed by someone else.
    private void clearRunLocked() {
        runId = null;
        model = null;
        languages = List.of();
        totalExercises = 0;
        state = null;
        startedAt = null;
        completedAt = null;
        durationSeconds = null;
        currentExercise = null;
        config = Map.of();
        statistics = null;
    }

    private void transitionLocked(RunState target) {
        if (!state.canTransitionTo(target)) {
            throw new TrackerConfigurationException("Run " + runId + " cannot move from "
                    + state.value() + " to " + target.value());
        }
        state = target;
        if (target.isTerminal()) {
            completedAt = clock.instant();
            durationSeconds = Duration.between(startedAt, completedAt).toMillis() / 1000.0;
        }
        LOGGER.info("Run {} is now {}", runId, target.value());
    }

    /**
     * Completed versus total exercises. Holds the lock only long enough to read two counters.
     */
    public Progress getProgress() {
        long completed;
        int total;
        synchronized (lock) {
            requireRunLocked();
            completed = statistics.completed();
            total = totalExercises;
        }
        return Progress.of(completed, total);
    }

    public StatisticsSnapshot getStatistics() {
        synchronized (lock) {
            requireRunLocked();
            return statistics.snapshot();
        }
    }

    public RunSnapshot snapshot() {
        synchronized (lock) {
            requireRunLocked();
            return snapshotLocked();
        }
    }

    public RunState state() {
        synchronized (lock) {
            requireRunLocked();
            return state;
        }
    }

    /**
     * Writes the final report for the run to its own file next to the live state.
     */
    public Path exportReport() throws PersistenceException {
        RunSnapshot snapshot;
        StatisticsSnapshot stats;
        synchronized (lock) {
            requireRunLocked();
            snapshot = snapshotLocked();
            stats = statistics.snapshot();
        }
        return new ReportExporter(store, clock).export(snapshot, stats);
    }

    /**
     * Writes the current state if the last write did not succeed.
     */
    public void flush() throws PersistenceException {
        RunSnapshot snapshot;
        long snapshotVersion;
        synchronized (lock) {
            requireRunLocked();
            snapshot = snapshotLocked();
            snapshotVersion = version;
        }
        persist(snapshotVersion, snapshot);
    }

    public TrackerStore store() {
        return store;
    }

    private void persist(long snapshotVersion, RunSnapshot snapshot) throws PersistenceException {
        synchronized (writeLock) {
            if (snapshotVersion <= persistedVersion) {
                return;
            }
            store.save(snapshot);
            persistedVersion = snapshotVersion;
        }
    }

    private ExerciseSnapshot publishLocked(ExerciseRecord record) {
        ExerciseSnapshot snapshot = record.snapshot();
        published.put(record.key(), snapshot);
        return snapshot;
    }

    private RunSnapshot snapshotLocked() {
        return new RunSnapshot(
                runId,
                model,
                languages,
                totalExercises,
                state,
                startedAt,
                completedAt,
                durationSeconds,
                currentExercise,
                config,
                Collections.unmodifiableMap(new LinkedHashMap<>(published))
        );
    }

    private void requireRunLocked() {
        if (runId == null) {
            throw new TrackerConfigurationException("No active benchmark run");
        }
    }

    private void requireActiveRunLocked(String key) {
        requireRunLocked();
        if (state != RunState.RUNNING && state != RunState.PAUSED) {
            throw new TrackerConfigurationException("Cannot update exercise " + key + ": run " + runId + " is " + state.value());
        }
    }

    private static void requireName(String name, String language) {
        if (name == null || name.isBlank() || language == null || language.isBlank()) {
            throw new IllegalArgumentException("Exercise name and language must not be blank");
        }
    }
}
