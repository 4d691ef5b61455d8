package com.example.benchtracker;

/**
 * Thrown for lifecycle calls that are invalid for the current run or exercise state.
 * These are caller bugs and are never absorbed by the tracker.
 */
public class TrackerConfigurationException extends IllegalStateException {
    public TrackerConfigurationException(String message) {
        super(message);
    }
}
