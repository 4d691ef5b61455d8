package com.example.benchtracker;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void positionalArgumentsDefaultToAutoDetect() {
        MonitorConfig config = loader.fromArguments(List.of());

        assertEquals(Optional.empty(), config.stateDirectory());
        assertEquals(ConfigLoader.DEFAULT_REFRESH_INTERVAL, config.refreshInterval());
        assertTrue(config.autoDetect());
        assertTrue(config.clearScreen());
    }

    @Test
    void positionalArgumentsAreParsed() {
        MonitorConfig config = loader.fromArguments(List.of("runs/2025-01-01--x", "2", "no"));

        assertEquals(Optional.of(Path.of("runs/2025-01-01--x")), config.stateDirectory());
        assertEquals(2, config.refreshInterval());
        assertFalse(config.autoDetect());
        assertEquals(Optional.empty(), loader.fromArguments(List.of("none", "3")).stateDirectory());
        assertTrue(loader.fromArguments(List.of("none", "3", "1")).autoDetect());
    }

    @Test
    void unusableArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> loader.fromArguments(List.of("none", "often")));
        assertThrows(IllegalArgumentException.class, () -> loader.fromArguments(List.of("none", "0")));
        assertThrows(IllegalArgumentException.class, () -> loader.fromArguments(List.of("none", "5", "maybe")));
        assertThrows(IllegalArgumentException.class, () -> loader.fromArguments(List.of("a", "5", "true", "extra")));
    }

    @Test
    void jsonConfigFillsMissingValuesWithDefaults() throws Exception {
        Path file = Files.createTempFile("monitor-config", ".json");
        Files.writeString(file, "{\"refreshInterval\": 10, \"benchmarksRoot\": \"/data/runs\","
                + " \"clearScreen\": false, \"comment\": \"ignored\"}");

        MonitorConfig config = loader.load(file);

        assertEquals(Optional.empty(), config.stateDirectory());
        assertEquals(10, config.refreshInterval());
        assertTrue(config.autoDetect());
        assertEquals(Path.of("/data/runs"), config.benchmarksRoot());
        assertFalse(config.clearScreen());
    }

    @Test
    void jsonConfigWithExplicitDirectory() throws Exception {
        Path file = Files.createTempFile("monitor-config", ".json");
        Files.writeString(file, "{\"stateDirectory\": \"out/.tracker\", \"autoDetect\": false}");

        MonitorConfig config = loader.load(file);

        assertEquals(Optional.of(Path.of("out/.tracker")), config.stateDirectory());
        assertFalse(config.autoDetect());
        assertEquals(DirectoryScanner.DEFAULT_ROOT, config.benchmarksRoot());
    }

    @Test
    void jsonConfigRejectsZeroInterval() throws Exception {
        Path file = Files.createTempFile("monitor-config", ".json");
        Files.writeString(file, "{\"refreshInterval\": 0}");

        assertThrows(IllegalArgumentException.class, () -> loader.load(file));
    }
}
