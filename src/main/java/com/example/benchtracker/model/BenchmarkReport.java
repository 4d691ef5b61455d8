package com.example.benchtracker.model;

import java.time.Instant;

/**
 * Final report for a run: the frozen run state plus the statistics computed from it.
 */
public record BenchmarkReport(
        Metadata metadata,
        RunSnapshot run,
        Progress progress,
        StatisticsSnapshot statistics
) {
    public record Metadata(
            Instant generatedAt,
            String trackerVersion
    ) {
    }
}
