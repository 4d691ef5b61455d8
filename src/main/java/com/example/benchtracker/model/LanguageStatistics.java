package com.example.benchtracker.model;

public record LanguageStatistics(
        long started,
        long completed,
        long passed,
        long failed,
        long skipped,
        long errored,
        double successRate
) {
}
