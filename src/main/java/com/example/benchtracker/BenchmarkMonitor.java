package com.example.benchtracker;

import com.example.benchtracker.model.RunSnapshot;
import com.example.benchtracker.model.StatisticsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Polls a run's tracker directory and redraws its progress on every tick. Runs on a single
 * thread, normally in its own process, and never writes tracked state.
 *
 * <p>With auto-detection on, each tick rescans the benchmarks root and follows any run directory
 * newer than the one being shown. Missing or unreadable state is reported and retried on the
 * next tick.
 */
public final class BenchmarkMonitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BenchmarkMonitor.class);

    enum TickOutcome {
        DISPLAYED,
        WAITING,
        TRANSIENT_ERROR
    }

    private final MonitorConfig config;
    private final DirectoryScanner scanner;
    private final MonitorDisplay display;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    private RunDirectory currentRun;
    private TrackerStore store;
    private boolean followNewerRuns;
    private int idleTicks;

    public BenchmarkMonitor(MonitorConfig config, MonitorDisplay display) {
        this(config, new DirectoryScanner(config.benchmarksRoot()), display);
    }

    BenchmarkMonitor(MonitorConfig config, DirectoryScanner scanner, MonitorDisplay display) {
        this.config = config;
        this.scanner = scanner;
        this.display = display;
    }

    /**
     * Runs until {@link #stop()} is called.
     *
     * @throws BenchmarkNotFoundException if auto-detection is off and no state directory resolves
     */
    public void run() throws BenchmarkNotFoundException {
        try {
            resolveInitialTarget();
            LOGGER.info("Monitoring {} every {}s (auto-detect {})",
                    store == null ? "nothing yet" : store.directory(), config.refreshInterval(), config.autoDetect());
            while (true) {
                tick();
                if (awaitStop()) {
                    break;
                }
            }
            display.stopped();
        } finally {
            finished.countDown();
        }
    }

    /**
     * Ends the loop at its next wait, or immediately if it is waiting.
     *
     * @return true if the monitor was still running when asked to stop
     */
    public boolean stop() {
        boolean running = finished.getCount() > 0;
        stopSignal.countDown();
        return running;
    }

    /**
     * Waits for {@link #run()} to return.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    Optional<RunDirectory> currentRun() {
        return Optional.ofNullable(currentRun);
    }

    Optional<TrackerStore> store() {
        return Optional.ofNullable(store);
    }

    void resolveInitialTarget() throws BenchmarkNotFoundException {
        if (config.stateDirectory().isPresent()) {
            Path requested = config.stateDirectory().get();
            Optional<Path> trackerDirectory = resolveTrackerDirectory(requested);
            if (trackerDirectory.isPresent()) {
                Path runDirectory = runDirectoryOf(trackerDirectory.get());
                currentRun = RunDirectory.of(runDirectory.toAbsolutePath().normalize());
                store = new TrackerStore(trackerDirectory.get());
                // Only conventionally named runs can be ordered against newer ones.
                followNewerRuns = config.autoDetect() && DirectoryScanner.isRunDirectoryName(currentRun.name());
                return;
            }
            if (!config.autoDetect()) {
                throw new BenchmarkNotFoundException("State directory not found: " + requested);
            }
            LOGGER.warn("State directory {} not found, waiting for a benchmark under {}", requested, scanner.root());
        } else if (!config.autoDetect()) {
            RunDirectory latest = scanner.findLatest().orElseThrow(() -> new BenchmarkNotFoundException(
                    "No benchmark runs found in " + scanner.root()));
            currentRun = latest;
            store = latest.store();
            return;
        }
        followNewerRuns = true;
    }

    /**
     * Accepts either a tracker directory or a run directory that contains one.
     */
    static Optional<Path> resolveTrackerDirectory(Path requested) {
        if (requested.getFileName() != null
                && requested.getFileName().toString().equals(TrackerStore.TRACKER_DIRECTORY)
                && Files.isDirectory(requested)) {
            return Optional.of(requested);
        }
        Path nested = TrackerStore.trackerDirectory(requested);
        if (Files.isDirectory(nested)) {
            return Optional.of(nested);
        }
        if (Files.isDirectory(requested)) {
            return Optional.of(requested);
        }
        return Optional.empty();
    }

    private static Path runDirectoryOf(Path trackerDirectory) {
        Path parent = trackerDirectory.getParent();
        boolean nested = trackerDirectory.getFileName() != null
                && trackerDirectory.getFileName().toString().equals(TrackerStore.TRACKER_DIRECTORY);
        return nested && parent != null ? parent : trackerDirectory;
    }

    TickOutcome tick() {
        if (followNewerRuns) {
            Optional<RunDirectory> latest = scanner.findLatest();
            if (latest.isPresent() && latest.get().isNewerThan(currentRun)) {
                switchTo(latest.get());
            }
        }

        if (store == null) {
            idleTicks++;
            display.waitingForBenchmark(scanner.root(), idleTicks);
            return TickOutcome.WAITING;
        }

        try {
            Optional<RunSnapshot> snapshot = store.loadLatest();
            if (snapshot.isEmpty()) {
                idleTicks++;
                display.waitingForState(store.directory(), idleTicks);
                return TickOutcome.WAITING;
            }
            idleTicks = 0;
            StatisticsSnapshot statistics = StatisticsEngine.compute(snapshot.get());
            display.render(currentRun, snapshot.get(), statistics);
            return TickOutcome.DISPLAYED;
        } catch (PersistenceException ex) {
            LOGGER.warn("Could not read benchmark state, retrying next tick: {}", ex.getMessage());
            display.transientError(ex.getMessage());
            return TickOutcome.TRANSIENT_ERROR;
        }
    }

    private void switchTo(RunDirectory latest) {
        display.reset();
        if (currentRun != null) {
            LOGGER.info("Switching from {} to newer benchmark {}", currentRun.name(), latest.name());
            display.switched(latest.name());
        } else {
            LOGGER.info("Found benchmark {}", latest.name());
        }
        currentRun = latest;
        store = latest.store();
        idleTicks = 0;
    }

    private boolean awaitStop() {
        try {
            return stopSignal.await(config.refreshInterval(), TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
