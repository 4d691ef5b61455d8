package com.example.benchtracker.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates derived from a run's exercises. Never stored on its own in the live state file;
 * it can always be rebuilt from a {@link RunSnapshot}.
 *
 * <p>{@code passRate} is relative to the declared total, {@code successRate} to the exercises
 * finished so far. Both are percentages rounded to two decimals.
 */
public record StatisticsSnapshot(
        int totalExercises,
        long completed,
        long passed,
        long failed,
        long skipped,
        long errored,
        double passRate,
        double successRate,
        double totalCost,
        long totalTokens,
        double averageCostPerExercise,
        double averageTokensPerExercise,
        Map<String, Double> metricTotals,
        Map<String, LanguageStatistics> byLanguage,
        Double averageDurationSeconds,
        Double estimatedRemainingSeconds
) {
    public StatisticsSnapshot {
        metricTotals = metricTotals == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metricTotals));
        byLanguage = byLanguage == null ? Map.of() : byLanguage;
    }
}
