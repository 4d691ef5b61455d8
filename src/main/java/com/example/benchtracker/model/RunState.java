package com.example.benchtracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a benchmark run. Serialized as the lowercase state name.
 */
public enum RunState {
    INITIALIZING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Returns true if a run in this state may move directly to {@code target}.
     */
    public boolean canTransitionTo(RunState target) {
        switch (this) {
            case INITIALIZING:
                return target == RUNNING || target == FAILED || target == CANCELLED;
            case RUNNING:
                return target == PAUSED || target.isTerminal();
            case PAUSED:
                return target == RUNNING || target.isTerminal();
            default:
                return false;
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a persisted state name, rejecting anything unrecognized.
     */
    @JsonCreator
    public static RunState fromValue(String value) {
        if (value != null) {
            for (RunState state : values()) {
                if (state.value().equals(value.toLowerCase(Locale.ROOT))) {
                    return state;
                }
            }
        }
        throw new IllegalArgumentException("Unknown run state: " + value);
    }
}
