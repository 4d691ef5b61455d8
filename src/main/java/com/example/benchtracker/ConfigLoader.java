package com.example.benchtracker;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds a {@link MonitorConfig} from positional command-line arguments or from a JSON file.
 */
public class ConfigLoader {
    public static final String ROOT_PROPERTY = "benchtracker.root";
    static final int DEFAULT_REFRESH_INTERVAL = 5;
    private static final String NO_DIRECTORY = "none";
    private static final List<String> TRUE_VALUES = List.of("true", "1", "yes");
    private static final List<String> FALSE_VALUES = List.of("false", "0", "no");

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Reads {@code [state_dir|none] [refresh_interval] [auto_detect]}; missing trailing
     * arguments take their defaults.
     */
    public MonitorConfig fromArguments(List<String> args) {
        if (args.size() > 3) {
            throw new IllegalArgumentException("Expected at most 3 arguments, got " + args.size());
        }
        Optional<Path> stateDirectory = args.isEmpty() ? Optional.empty() : stateDirectory(args.get(0));
        int refreshInterval = args.size() > 1 ? refreshInterval(args.get(1)) : DEFAULT_REFRESH_INTERVAL;
        boolean autoDetect = args.size() <= 2 || parseBoolean(args.get(2));
        Path root = Path.of(System.getProperty(ROOT_PROPERTY, DirectoryScanner.DEFAULT_ROOT.toString()));
        return new MonitorConfig(stateDirectory, refreshInterval, autoDetect, root, true);
    }

    public MonitorConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        Optional<Path> stateDirectory = raw.stateDirectory == null ? Optional.empty() : stateDirectory(raw.stateDirectory);
        int refreshInterval = raw.refreshInterval != null ? checkInterval(raw.refreshInterval) : DEFAULT_REFRESH_INTERVAL;
        boolean autoDetect = raw.autoDetect == null || raw.autoDetect;
        Path root = raw.benchmarksRoot == null || raw.benchmarksRoot.isBlank()
                ? DirectoryScanner.DEFAULT_ROOT
                : Path.of(raw.benchmarksRoot);
        boolean clearScreen = raw.clearScreen == null || raw.clearScreen;
        return new MonitorConfig(stateDirectory, refreshInterval, autoDetect, root, clearScreen);
    }

    private Optional<Path> stateDirectory(String value) {
        if (value.isBlank() || NO_DIRECTORY.equalsIgnoreCase(value)) {
            return Optional.empty();
        }
        return Optional.of(Path.of(value));
    }

    private int refreshInterval(String value) {
        try {
            return checkInterval(Integer.parseInt(value.trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("refresh_interval must be a whole number of seconds: " + value, ex);
        }
    }

    private int checkInterval(int seconds) {
        if (seconds < 1) {
            throw new IllegalArgumentException("refresh_interval must be at least 1 second: " + seconds);
        }
        return seconds;
    }

    static boolean parseBoolean(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return true;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return false;
        }
        throw new IllegalArgumentException("auto_detect must be true or false: " + value);
    }

    private static class RawConfig {
        public String stateDirectory;
        public Integer refreshInterval;
        public Boolean autoDetect;
        public String benchmarksRoot;
        public Boolean clearScreen;
    }
}
