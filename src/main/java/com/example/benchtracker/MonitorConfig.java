package com.example.benchtracker;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for the monitor.
 *
 * @param stateDirectory  explicit tracker or run directory; empty means "find the latest run"
 * @param refreshInterval seconds between ticks
 * @param autoDetect      keep scanning {@code benchmarksRoot} and follow newer runs
 * @param benchmarksRoot  directory holding the timestamp-named run directories
 * @param clearScreen     clear the terminal before each redraw
 */
public record MonitorConfig(
        Optional<Path> stateDirectory,
        int refreshInterval,
        boolean autoDetect,
        Path benchmarksRoot,
        boolean clearScreen
) {
}
