package com.rpyflow;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Simple logging utility that writes to the console and, optionally, to a file.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final PrintStream errorOutput;
    private final boolean consoleEnabled;

    private static AppLogger instance;

    private AppLogger(Path logFile, boolean consoleEnabled) throws IOException {
        this.consoleOutput = System.out;
        this.errorOutput = System.err;
        this.consoleEnabled = consoleEnabled;

        if (logFile != null) {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // Append so consecutive runs share one file
            FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
            this.fileOutput = new PrintStream(fos, true, "UTF-8");

            String separator = "=".repeat(60);
            fileOutput.println();
            fileOutput.println(separator);
            fileOutput.println("rpyflow run started at " + LocalDateTime.now().format(TIME_FORMAT));
            fileOutput.println(separator);
        } else {
            this.fileOutput = null;
        }
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled);
        }
    }

    public static AppLogger get() {
        return instance;
    }

    public void info(String message) {
        log("INFO", message, consoleOutput);
    }

    public void warn(String message) {
        log("WARN", message, errorOutput);
    }

    public void error(String message) {
        log("ERROR", message, errorOutput);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message, errorOutput);
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
    }

    private void log(String level, String message, PrintStream console) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String line = String.format("[%s] [%s] %s", timestamp, level, message);

        if (fileOutput != null) {
            fileOutput.println(line);
        }

        if (consoleEnabled) {
            console.println(line);
        }
    }

    /**
     * Prints a plain line without timestamp or level (banner and run summary).
     */
    public void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        if (fileOutput != null) {
            fileOutput.println(message);
        }
    }
}
