package com.example.benchtracker.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Complete persisted state of a benchmark run. This is the payload of the live state file.
 */
public record RunSnapshot(
        String runId,
        String model,
        List<String> languages,
        int totalExercises,
        RunState state,
        Instant startedAt,
        Instant completedAt,
        Double durationSeconds,
        String currentExercise,
        Map<String, Object> config,
        Map<String, ExerciseSnapshot> exercises
) {
    public RunSnapshot {
        languages = languages == null ? List.of() : List.copyOf(languages);
        config = config == null ? Map.of() : config;
        exercises = exercises == null ? Map.of() : exercises;
    }

    /**
     * Number of exercises that reached a terminal state.
     */
    public long finishedExercises() {
        return exercises.values().stream().filter(exercise -> exercise.state().isTerminal()).count();
    }
}
