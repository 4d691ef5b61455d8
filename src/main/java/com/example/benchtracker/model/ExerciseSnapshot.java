package com.example.benchtracker.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Serialized state of one exercise, stored under its {@code language/name} key.
 */
public record ExerciseSnapshot(
        String name,
        String language,
        ExerciseState state,
        int attempts,
        int maxAttempts,
        List<Double> durations,
        Map<String, Object> metrics,
        String errorMessage,
        Instant startedAt,
        Instant completedAt
) {
    public ExerciseSnapshot {
        durations = durations == null ? List.of() : List.copyOf(durations);
        metrics = metrics == null ? Map.of() : metrics;
    }

    /**
     * Builds the map key used for an exercise within a run.
     */
    public static String key(String language, String name) {
        return language + "/" + name;
    }

    public String key() {
        return key(language, name);
    }

    /**
     * Total time spent across all recorded attempts, in seconds.
     */
    public double totalDurationSeconds() {
        double total = 0.0;
        for (Double duration : durations) {
            total += duration;
        }
        return total;
    }
}
