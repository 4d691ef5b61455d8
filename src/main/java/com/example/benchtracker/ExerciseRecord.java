package com.example.benchtracker;

import com.example.benchtracker.model.ExerciseSnapshot;
import com.example.benchtracker.model.ExerciseState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live, mutable state of one exercise. Only accessed under the tracker lock.
 */
final class ExerciseRecord {
    private final String name;
    private final String language;
    private ExerciseState state = ExerciseState.PENDING;
    private int attempts;
    private int maxAttempts;
    private final List<Double> durations = new ArrayList<>();
    private final Map<String, Object> metrics = new LinkedHashMap<>();
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    ExerciseRecord(String name, String language, int maxAttempts) {
        this.name = name;
        this.language = language;
        this.maxAttempts = maxAttempts;
    }

    static ExerciseRecord restore(ExerciseSnapshot snapshot) {
        ExerciseRecord record = new ExerciseRecord(snapshot.name(), snapshot.language(), snapshot.maxAttempts());
        record.state = snapshot.state();
        record.attempts = snapshot.attempts();
        record.durations.addAll(snapshot.durations());
        record.metrics.putAll(snapshot.metrics());
        record.errorMessage = snapshot.errorMessage();
        record.startedAt = snapshot.startedAt();
        record.completedAt = snapshot.completedAt();
        return record;
    }

    String key() {
        return ExerciseSnapshot.key(language, name);
    }

    String language() {
        return language;
    }

    ExerciseState state() {
        return state;
    }

    int attempts() {
        return attempts;
    }

    int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Begins an attempt. When the exercise is already running the previous attempt is closed
     * out first and counted as abandoned.
     */
    void beginAttempt(Instant now, int allowedAttempts) {
        if (state == ExerciseState.RUNNING) {
            recordDuration(now);
        } else {
            maxAttempts = allowedAttempts;
        }
        state = ExerciseState.RUNNING;
        attempts++;
        startedAt = now;
        completedAt = null;
    }

    void finish(ExerciseState outcome, Instant now, Map<String, Object> newMetrics, String message) {
        if (state == ExerciseState.RUNNING) {
            recordDuration(now);
        }
        state = outcome;
        metrics.putAll(newMetrics);
        errorMessage = message;
        completedAt = now;
    }

    private void recordDuration(Instant now) {
        if (startedAt != null) {
            durations.add(Duration.between(startedAt, now).toNanos() / 1_000_000_000.0);
        }
    }

    ExerciseSnapshot snapshot() {
        return new ExerciseSnapshot(
                name,
                language,
                state,
                attempts,
                maxAttempts,
                durations,
                Collections.unmodifiableMap(new LinkedHashMap<>(metrics)),
                errorMessage,
                startedAt,
                completedAt
        );
    }
}
