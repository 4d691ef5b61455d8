package com.example.benchtracker;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryScannerTest {
    @Test
    void newestReadyRunWins() throws Exception {
        Path root = Files.createTempDirectory("scanner-test");
        readyRun(root, "2025-01-01--x");
        readyRun(root, "2025-01-02--y");
        readyRun(root, "2025-01-01--z");

        DirectoryScanner scanner = new DirectoryScanner(root);

        assertEquals("2025-01-02--y", scanner.findLatest().orElseThrow().name());
        assertEquals(root.resolve("2025-01-02--y"), scanner.findLatest().orElseThrow().path());
    }

    @Test
    void directoriesWithoutStateArePassedOver() throws Exception {
        Path root = Files.createTempDirectory("scanner-test");
        readyRun(root, "2025-01-01--x");
        Files.createDirectories(root.resolve("2025-01-03--no-tracker"));
        Files.createDirectories(root.resolve("2025-01-04--empty-tracker").resolve(TrackerStore.TRACKER_DIRECTORY));
        Path emptyState = root.resolve("2025-01-05--empty-state").resolve(TrackerStore.TRACKER_DIRECTORY);
        Files.createDirectories(emptyState);
        Files.createFile(emptyState.resolve("r1.json"));
        Path reportOnly = root.resolve("2025-01-06--report-only").resolve(TrackerStore.TRACKER_DIRECTORY);
        Files.createDirectories(reportOnly);
        Files.writeString(reportOnly.resolve("report_r1.json"), "{}");

        DirectoryScanner scanner = new DirectoryScanner(root);

        assertEquals(5, scanner.listCandidates().size());
        assertEquals("2025-01-01--x", scanner.findLatest().orElseThrow().name());
    }

    @Test
    void onlyConventionallyNamedDirectoriesCount() throws Exception {
        Path root = Files.createTempDirectory("scanner-test");
        readyRun(root, "latest");
        readyRun(root, "2025-13--bad");
        Files.writeString(root.resolve("2025-02-01--file"), "not a directory");
        readyRun(root, "2025-01-01-09-30-00--timed");
        readyRun(root, "2025-01-01--dated");

        List<RunDirectory> candidates = new DirectoryScanner(root).listCandidates();

        assertEquals(List.of("2025-01-01-09-30-00--timed", "2025-01-01--dated"),
                candidates.stream().map(RunDirectory::name).toList());
    }

    @Test
    void missingOrEmptyRootFindsNothing() throws Exception {
        Path root = Files.createTempDirectory("scanner-test");

        assertTrue(new DirectoryScanner(root).listCandidates().isEmpty());
        assertFalse(new DirectoryScanner(root).findLatest().isPresent());
        assertFalse(new DirectoryScanner(root.resolve("missing")).findLatest().isPresent());
    }

    @Test
    void recognizesRunDirectoryNames() {
        assertTrue(DirectoryScanner.isRunDirectoryName("2025-01-07-14-03-22--sonnet-python"));
        assertTrue(DirectoryScanner.isRunDirectoryName("2025-01-07--x"));
        assertFalse(DirectoryScanner.isRunDirectoryName("2025-01-07-x"));
        assertFalse(DirectoryScanner.isRunDirectoryName("2025-01-07--"));
        assertFalse(DirectoryScanner.isRunDirectoryName(".tracker"));
    }

    @Test
    void laterNamesAreNewer() {
        RunDirectory older = RunDirectory.of(Path.of("2025-01-01--x"));
        RunDirectory newer = RunDirectory.of(Path.of("2025-01-02--y"));

        assertTrue(newer.isNewerThan(older));
        assertFalse(older.isNewerThan(newer));
        assertFalse(newer.isNewerThan(newer));
        assertTrue(older.isNewerThan(null));
    }

    private static void readyRun(Path root, String name) throws Exception {
        Path trackerDirectory = TrackerStore.trackerDirectory(root.resolve(name));
        Files.createDirectories(trackerDirectory);
        Files.writeString(trackerDirectory.resolve("run.json"), "{\"run_id\": \"run\", \"state\": \"running\"}");
    }
}
