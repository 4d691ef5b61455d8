package com.example.benchtracker.model;

/**
 * Completed versus total exercise counts for a run.
 */
public record Progress(
        long completed,
        int total,
        double percentage
) {
    public static Progress of(long completed, int total) {
        double percentage = total > 0 ? Math.round(completed * 10000.0 / total) / 100.0 : 0.0;
        return new Progress(completed, total, percentage);
    }
}
