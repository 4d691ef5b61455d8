package com.example.benchtracker;

import com.example.benchtracker.model.ExerciseSnapshot;
import com.example.benchtracker.model.ExerciseState;
import com.example.benchtracker.model.LanguageStatistics;
import com.example.benchtracker.model.RunSnapshot;
import com.example.benchtracker.model.StatisticsSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running aggregates for one run. Each exercise is folded in once, when it first appears and
 * again when it finishes, so the cost of an update does not depend on the size of the run.
 *
 * <p>Instances are not thread-safe; {@link BenchmarkTracker} only touches them under its lock.
 * {@link #compute(RunSnapshot)} rebuilds the same aggregates from persisted state, which is how
 * the monitor gets its numbers.
 */
public final class StatisticsEngine {
    static final String COST = "cost";
    static final String TOTAL_TOKENS = "total_tokens";
    static final String TOKENS = "tokens";
    static final String TOKENS_SENT = "tokens_sent";
    static final String TOKENS_RECEIVED = "tokens_received";

    private final int totalExercises;
    private final Map<String, LanguageTally> languages = new LinkedHashMap<>();
    private final Map<String, Double> metricTotals = new TreeMap<>();
    private long completed;
    private long passed;
    private long failed;
    private long skipped;
    private long errored;
    private double totalCost;
    private long totalTokens;
    private double totalDurationSeconds;
    private long timedExercises;
    private StatisticsSnapshot cached;

    public StatisticsEngine(int totalExercises, List<String> declaredLanguages) {
        this.totalExercises = totalExercises;
        for (String language : declaredLanguages) {
            languages.put(language, new LanguageTally());
        }
    }

    /**
     * Rebuilds the aggregates of a persisted run from scratch.
     */
    public static StatisticsSnapshot compute(RunSnapshot run) {
        StatisticsEngine engine = new StatisticsEngine(run.totalExercises(), run.languages());
        for (ExerciseSnapshot exercise : run.exercises().values()) {
            engine.exerciseAdded(exercise.language());
            if (exercise.state().isTerminal()) {
                engine.exerciseFinished(exercise);
            }
        }
        return engine.snapshot();
    }

    /**
     * Counts an exercise key the run has not seen before.
     */
    public void exerciseAdded(String language) {
        tally(language).started++;
        cached = null;
    }

    /**
     * Folds a finished exercise into the totals. Must be called once per exercise.
     */
    public void exerciseFinished(ExerciseSnapshot exercise) {
        ExerciseState state = exercise.state();
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Exercise " + exercise.key() + " is not finished: " + state.value());
        }
        LanguageTally tally = tally(exercise.language());
        completed++;
        tally.completed++;
        switch (state) {
            case PASSED:
                passed++;
                tally.passed++;
                break;
            case FAILED:
                failed++;
                tally.failed++;
                break;
            case SKIPPED:
                skipped++;
                tally.skipped++;
                break;
            default:
                errored++;
                tally.errored++;
                break;
        }

        Map<String, Object> metrics = exercise.metrics();
        totalCost += numeric(metrics.get(COST));
        totalTokens += tokensOf(metrics);
        for (Map.Entry<String, Object> entry : metrics.entrySet()) {
            Double value = asCount(entry.getValue());
            if (value != null) {
                metricTotals.merge(entry.getKey(), value, Double::sum);
            }
        }

        if (!exercise.durations().isEmpty()) {
            totalDurationSeconds += exercise.totalDurationSeconds();
            timedExercises++;
        }
        cached = null;
    }

    public long completed() {
        return completed;
    }

    /**
     * Returns the current aggregates, reusing the last result until something changes.
     */
    public StatisticsSnapshot snapshot() {
        if (cached == null) {
            cached = buildSnapshot();
        }
        return cached;
    }

    private StatisticsSnapshot buildSnapshot() {
        Map<String, LanguageStatistics> byLanguage = new LinkedHashMap<>();
        languages.forEach((language, tally) -> byLanguage.put(language, tally.toStatistics()));

        Map<String, Double> roundedTotals = new TreeMap<>();
        metricTotals.forEach((key, value) -> roundedTotals.put(key, round(value, 6)));

        Double averageDuration = timedExercises == 0 ? null : round(totalDurationSeconds / timedExercises, 2);
        Double remaining = averageDuration == null || completed == 0
                ? null
                : round(averageDuration * Math.max(0, totalExercises - completed), 2);
        long divisor = Math.max(completed, 1);

        return new StatisticsSnapshot(
                totalExercises,
                completed,
                passed,
                failed,
                skipped,
                errored,
                percentage(passed, totalExercises),
                percentage(passed, completed),
                round(totalCost, 6),
                totalTokens,
                round(totalCost / divisor, 6),
                round((double) totalTokens / divisor, 2),
                roundedTotals,
                byLanguage,
                averageDuration,
                remaining
        );
    }

    private LanguageTally tally(String language) {
        return languages.computeIfAbsent(language, ignored -> new LanguageTally());
    }

    static long tokensOf(Map<String, Object> metrics) {
        if (asNumber(metrics.get(TOTAL_TOKENS)) != null) {
            return (long) numeric(metrics.get(TOTAL_TOKENS));
        }
        if (asNumber(metrics.get(TOKENS)) != null) {
            return (long) numeric(metrics.get(TOKENS));
        }
        return (long) (numeric(metrics.get(TOKENS_SENT)) + numeric(metrics.get(TOKENS_RECEIVED)));
    }

    private static double numeric(Object value) {
        Double number = asNumber(value);
        return number == null ? 0.0 : number;
    }

    private static Double asNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return null;
    }

    // Flags such as "timed_out": true are summed as counters.
    private static Double asCount(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        return asNumber(value);
    }

    static double percentage(long part, long whole) {
        return whole <= 0 ? 0.0 : round(part * 100.0 / whole, 2);
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    private static final class LanguageTally {
        private long started;
        private long completed;
        private long passed;
        private long failed;
        private long skipped;
        private long errored;

        private LanguageStatistics toStatistics() {
            return new LanguageStatistics(started, completed, passed, failed, skipped, errored, percentage(passed, completed));
        }
    }
}
