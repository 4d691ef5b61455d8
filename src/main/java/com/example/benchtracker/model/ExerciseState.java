package com.example.benchtracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a single exercise within a run. Serialized as the lowercase state name.
 */
public enum ExerciseState {
    PENDING,
    RUNNING,
    PASSED,
    FAILED,
    SKIPPED,
    ERROR;

    public boolean isTerminal() {
        return this == PASSED || this == FAILED || this == SKIPPED || this == ERROR;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExerciseState fromValue(String value) {
        if (value != null) {
            for (ExerciseState state : values()) {
                if (state.value().equals(value.toLowerCase(Locale.ROOT))) {
                    return state;
                }
            }
        }
        throw new IllegalArgumentException("Unknown exercise state: " + value);
    }
}
