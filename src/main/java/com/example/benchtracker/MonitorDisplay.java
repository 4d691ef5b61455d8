package com.example.benchtracker;

import com.example.benchtracker.model.LanguageStatistics;
import com.example.benchtracker.model.RunSnapshot;
import com.example.benchtracker.model.StatisticsSnapshot;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Renders monitor frames as plain text. Each frame is assembled first and printed with a single
 * write so a redraw never shows half a frame.
 */
public class MonitorDisplay {
    private static final String CLEAR_SCREEN = "\033[H\033[2J";
    private static final String RULE = "=".repeat(60);
    private static final int BAR_LENGTH = 30;

    private final PrintStream out;
    private final boolean clearScreen;
    private final int refreshInterval;
    private final boolean autoDetect;
    private String notice;

    public MonitorDisplay(PrintStream out, MonitorConfig config) {
        this(out, config.clearScreen(), config.refreshInterval(), config.autoDetect());
    }

    MonitorDisplay(PrintStream out, boolean clearScreen, int refreshInterval, boolean autoDetect) {
        this.out = out;
        this.clearScreen = clearScreen;
        this.refreshInterval = refreshInterval;
        this.autoDetect = autoDetect;
    }

    /**
     * Forgets anything carried over from the previously tracked run.
     */
    public void reset() {
        notice = null;
    }

    /**
     * Announces a switch to a newer run on the next frame.
     */
    public void switched(String runDirectoryName) {
        notice = "Switched to new benchmark: " + runDirectoryName;
    }

    public void waitingForBenchmark(Path root, int tick) {
        StringBuilder frame = header();
        frame.append("\nWaiting for benchmark to start").append(".".repeat(tick % 4)).append('\n');
        frame.append("\nNo active benchmark found under ").append(root).append(".\n");
        print(footer(frame));
    }

    public void waitingForState(Path trackerDirectory, int tick) {
        StringBuilder frame = header();
        frame.append("\nMonitoring: ").append(trackerDirectory).append('\n');
        frame.append("Benchmark not started yet, no state written").append(".".repeat(tick % 4)).append('\n');
        print(footer(frame));
    }

    public void transientError(String message) {
        StringBuilder frame = header();
        frame.append("\nState temporarily unreadable, retrying: ").append(message).append('\n');
        print(footer(frame));
    }

    public void notFound(String message) {
        out.println("Benchmark state not found: " + message);
        out.println("Specify a state directory or start a benchmark first.");
        out.flush();
    }

    public void stopped() {
        out.println();
        out.println("Monitoring stopped.");
        out.flush();
    }

    public void render(RunDirectory runDirectory, RunSnapshot run, StatisticsSnapshot stats) {
        StringBuilder frame = header();
        frame.append("\nRun ID: ").append(run.runId()).append('\n');
        if (runDirectory != null) {
            frame.append("Directory: ").append(runDirectory.name()).append('\n');
        }
        frame.append("State: ").append(run.state().value()).append('\n');
        frame.append("Model: ").append(run.model()).append('\n');
        frame.append("Languages: ").append(String.join(", ", run.languages())).append('\n');
        if (run.currentExercise() != null) {
            frame.append("\nCurrently running: ").append(run.currentExercise()).append('\n');
        }

        long completed = stats.completed();
        int total = run.totalExercises();
        frame.append("\nProgress: [").append(progressBar(completed, total)).append("] ")
                .append(completed).append('/').append(total)
                .append(" (").append(format("%.1f", percent(completed, total))).append("%)\n");
        frame.append("Passed: ").append(stats.passed()).append('\n');
        frame.append("Failed: ").append(stats.failed()).append('\n');
        if (stats.skipped() > 0 || stats.errored() > 0) {
            frame.append("Skipped: ").append(stats.skipped()).append("  Errors: ").append(stats.errored()).append('\n');
        }
        if (stats.estimatedRemainingSeconds() != null && completed < total) {
            frame.append("\nEstimated time remaining: ").append(formatDuration(stats.estimatedRemainingSeconds())).append('\n');
        }

        if (completed > 0) {
            frame.append("\nSuccess rate: ").append(format("%.2f", stats.successRate())).append("%\n");
        }
        if (!stats.byLanguage().isEmpty()) {
            frame.append("\nBy language:\n");
            for (Map.Entry<String, LanguageStatistics> entry : stats.byLanguage().entrySet()) {
                LanguageStatistics language = entry.getValue();
                frame.append("  ").append(entry.getKey()).append(": ")
                        .append(format("%.2f", language.successRate())).append("% (")
                        .append(language.passed()).append('/').append(language.completed()).append(")\n");
            }
        }
        if (stats.totalCost() > 0 || stats.totalTokens() > 0) {
            frame.append("\nTotal cost: $").append(format("%.4f", stats.totalCost())).append('\n');
            frame.append("Total tokens: ").append(format("%,d", stats.totalTokens())).append('\n');
        }
        print(footer(frame));
    }

    static String progressBar(long completed, int total) {
        int filled = (int) (BAR_LENGTH * completed / Math.max(total, 1));
        filled = Math.min(BAR_LENGTH, Math.max(0, filled));
        return "█".repeat(filled) + "░".repeat(BAR_LENGTH - filled);
    }

    static String formatDuration(double seconds) {
        long whole = (long) seconds;
        return (whole / 60) + "m " + (whole % 60) + "s";
    }

    private static double percent(long completed, int total) {
        return total <= 0 ? 0.0 : completed * 100.0 / total;
    }

    private StringBuilder header() {
        StringBuilder frame = new StringBuilder();
        if (clearScreen) {
            frame.append(CLEAR_SCREEN);
        }
        frame.append(RULE).append('\n');
        frame.append("BENCHMARK TRACKING MONITOR\n");
        if (autoDetect) {
            frame.append("(Auto-detecting new runs)\n");
        }
        frame.append(RULE).append('\n');
        if (notice != null) {
            frame.append('\n').append(notice).append('\n');
        }
        return frame;
    }

    private String footer(StringBuilder frame) {
        String mode = autoDetect ? "Auto-refresh" : "Refreshing";
        frame.append('\n').append('[').append(mode).append(" every ").append(refreshInterval).append("s, Ctrl+C to exit]\n");
        return frame.toString();
    }

    private void print(String frame) {
        out.print(frame);
        out.flush();
    }

    private static String format(String pattern, Object value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
