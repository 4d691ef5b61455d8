package com.example.benchtracker;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {
    @Test
    void invalidArgumentsExitWithUsageError() {
        assertEquals(App.EXIT_USAGE, App.execute(List.of()));
        assertEquals(App.EXIT_USAGE, App.execute(List.of("watch")));
        assertEquals(App.EXIT_USAGE, App.execute(List.of("monitor", "none", "fast")));
        assertEquals(App.EXIT_USAGE, App.execute(List.of("report")));
    }

    @Test
    void reportCommandExportsPersistedRun() throws Exception {
        Path runDirectory = Files.createTempDirectory("app-test");
        TrackerStore store = TrackerStore.forRunDirectory(runDirectory);
        BenchmarkTracker tracker = new BenchmarkTracker(store);
        tracker.startRun("r1", "sonnet", List.of("go"), 1);
        tracker.startExercise("leap", "go");
        tracker.completeExercise("leap", "go", true, Map.of("cost", 0.2));

        assertEquals(App.EXIT_OK, App.execute(List.of("report", runDirectory.toString())));

        assertTrue(Files.exists(store.reportFile("r1")));
        assertEquals(1L, store.loadReport("r1").orElseThrow().statistics().passed());
        // Reports are written once.
        assertEquals(App.EXIT_USAGE, App.execute(List.of("report", runDirectory.toString(), "r1")));
    }

    @Test
    void reportCommandWithoutStateExitsNotFound() throws Exception {
        Path empty = Files.createTempDirectory("app-test");

        assertEquals(App.EXIT_NOT_FOUND, App.execute(List.of("report", empty.resolve("missing").toString())));
        assertEquals(App.EXIT_NOT_FOUND, App.execute(List.of("report", empty.toString())));
        assertEquals(App.EXIT_NOT_FOUND, App.execute(List.of("report", empty.toString(), "r9")));
    }
}
