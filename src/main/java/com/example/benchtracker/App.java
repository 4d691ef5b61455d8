package com.example.benchtracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    static final int EXIT_OK = 0;
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_USAGE = 2;
    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: java -jar bench-tracker.jar monitor [state_dir|none] [refresh_interval] [auto_detect]",
            "       java -jar bench-tracker.jar <monitor-config.json>",
            "       java -jar bench-tracker.jar report <state_dir> [run_id]");

    private App() {
    }

    public static void main(String[] args) {
        int status = execute(Arrays.asList(args));
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int execute(List<String> args) {
        if (args.isEmpty()) {
            LOGGER.error(USAGE);
            return EXIT_USAGE;
        }
        String command = args.get(0);
        try {
            if (command.equals("monitor")) {
                return monitor(new ConfigLoader().fromArguments(args.subList(1, args.size())));
            }
            if (command.equals("report")) {
                return report(args.subList(1, args.size()));
            }
            if (command.endsWith(".json") && args.size() == 1) {
                return monitor(new ConfigLoader().load(Path.of(command)));
            }
            LOGGER.error(USAGE);
            return EXIT_USAGE;
        } catch (IllegalArgumentException ex) {
            LOGGER.error("{}{}{}", ex.getMessage(), System.lineSeparator(), USAGE);
            return EXIT_USAGE;
        } catch (TrackerConfigurationException ex) {
            LOGGER.error("{}", ex.getMessage());
            return EXIT_USAGE;
        } catch (IOException ex) {
            LOGGER.error("Failed to read benchmark files", ex);
            return EXIT_USAGE;
        }
    }

    private static int monitor(MonitorConfig config) {
        BenchmarkMonitor monitor = new BenchmarkMonitor(config, new MonitorDisplay(System.out, config));
        Thread hook = new Thread(() -> {
            if (!monitor.stop()) {
                return;
            }
            try {
                monitor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            // An interrupted monitor is a normal exit; the JVM would otherwise report the signal.
            Runtime.getRuntime().halt(EXIT_OK);
        }, "monitor-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            monitor.run();
            return EXIT_OK;
        } catch (BenchmarkNotFoundException ex) {
            new MonitorDisplay(System.out, config).notFound(ex.getMessage());
            LOGGER.error("{}", ex.getMessage());
            return EXIT_NOT_FOUND;
        }
    }

    private static int report(List<String> args) throws IOException {
        if (args.isEmpty() || args.size() > 2) {
            throw new IllegalArgumentException("report needs a state directory and optionally a run id");
        }
        Optional<Path> trackerDirectory = BenchmarkMonitor.resolveTrackerDirectory(Path.of(args.get(0)));
        if (trackerDirectory.isEmpty()) {
            LOGGER.error("State directory not found: {}", args.get(0));
            return EXIT_NOT_FOUND;
        }
        TrackerStore store = new TrackerStore(trackerDirectory.get());
        Optional<String> runId = args.size() > 1
                ? Optional.of(args.get(1))
                : store.listRunIds().stream().findFirst();
        Optional<Path> report = runId.isEmpty()
                ? Optional.empty()
                : new ReportExporter(store).exportPersisted(runId.get());
        if (report.isEmpty()) {
            LOGGER.error("No benchmark state found in {}", store.directory());
            return EXIT_NOT_FOUND;
        }
        System.out.println(report.get());
        return EXIT_OK;
    }
}
