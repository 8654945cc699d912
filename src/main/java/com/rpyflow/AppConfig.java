package com.rpyflow;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command-line configuration of one run.
 */
public class AppConfig {

    public static final String DEFAULT_SETTINGS_FILE = "config.ini";

    private final Path settingsPath;
    private final Path logFile;
    private final boolean showDiff;
    private final boolean quiet;
    private final List<String> ignoredArgs;

    private AppConfig(Path settingsPath, Path logFile, boolean showDiff, boolean quiet, List<String> ignoredArgs) {
        this.settingsPath = settingsPath;
        this.logFile = logFile;
        this.showDiff = showDiff;
        this.quiet = quiet;
        this.ignoredArgs = Collections.unmodifiableList(ignoredArgs);
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    /** Run log file, or null to log to the console only. */
    public Path getLogFile() {
        return logFile;
    }

    public boolean isShowDiff() {
        return showDiff;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /** Arguments that were not recognised. */
    public List<String> getIgnoredArgs() {
        return ignoredArgs;
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path settingsPath = null;
        private Path logFile = null;
        private boolean showDiff = false;
        private boolean quiet = false;
        private final List<String> ignoredArgs = new ArrayList<>();

        public Builder settingsPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.settingsPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder logFile(String path) {
            if (path != null && !path.isEmpty()) {
                this.logFile = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder showDiff(boolean showDiff) {
            this.showDiff = showDiff;
            return this;
        }

        public Builder quiet(boolean quiet) {
            this.quiet = quiet;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // Handle --log-file=value or --log-file value
                if (arg.startsWith("--log-file=")) {
                    logFile(arg.substring("--log-file=".length()));
                } else if ("--log-file".equals(arg) && i + 1 < args.length) {
                    logFile(args[++i]);
                }

                else if ("--diff".equals(arg)) {
                    this.showDiff = true;
                } else if ("--quiet".equals(arg)) {
                    this.quiet = true;
                }

                // First positional argument is the settings file
                else if (!arg.startsWith("--") && settingsPath == null) {
                    settingsPath(arg);
                } else {
                    ignoredArgs.add(arg);
                }
            }
            return this;
        }

        public AppConfig build() {
            Path settings = settingsPath != null
                ? settingsPath
                : Paths.get(DEFAULT_SETTINGS_FILE).toAbsolutePath().normalize();
            return new AppConfig(settings, logFile, showDiff, quiet, ignoredArgs);
        }
    }
}
