package com.example.benchtracker;

import com.example.benchtracker.model.BenchmarkReport;
import com.example.benchtracker.model.Progress;
import com.example.benchtracker.model.RunSnapshot;
import com.example.benchtracker.model.StatisticsSnapshot;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

/**
 * Freezes a run and its statistics into a {@link BenchmarkReport} and writes it through the store.
 */
public final class ReportExporter {
    public static final String TRACKER_VERSION = "1.0.0";

    private final TrackerStore store;
    private final Clock clock;

    public ReportExporter(TrackerStore store) {
        this(store, Clock.systemUTC());
    }

    public ReportExporter(TrackerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public BenchmarkReport build(RunSnapshot run, StatisticsSnapshot statistics) {
        return new BenchmarkReport(
                new BenchmarkReport.Metadata(clock.instant(), TRACKER_VERSION),
                run,
                Progress.of(statistics.completed(), run.totalExercises()),
                statistics
        );
    }

    public Path export(RunSnapshot run, StatisticsSnapshot statistics) throws PersistenceException {
        return store.exportReport(build(run, statistics));
    }

    /**
     * Exports a report from persisted state alone, for runs whose writer is gone.
     * Returns empty when the store has no state for {@code runId}.
     */
    public Optional<Path> exportPersisted(String runId) throws PersistenceException {
        Optional<RunSnapshot> run = store.load(runId);
        if (run.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(export(run.get(), StatisticsEngine.compute(run.get())));
    }
}
