package com.rpyflow;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void defaultsToConfigIniInWorkingDirectory() {
        AppConfig config = new AppConfig.Builder().parseArgs(new String[0]).build();

        assertEquals(Path.of("config.ini").toAbsolutePath().normalize(), config.getSettingsPath());
        assertNull(config.getLogFile());
        assertFalse(config.isShowDiff());
        assertFalse(config.isQuiet());
    }

    @Test
    void parsesFlagsAndSettingsFile() {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--diff", "project/settings.ini", "--quiet", "--log-file=logs/run.log"})
            .build();

        assertEquals(Path.of("project/settings.ini").toAbsolutePath().normalize(), config.getSettingsPath());
        assertEquals(Path.of("logs/run.log").toAbsolutePath().normalize(), config.getLogFile());
        assertTrue(config.isShowDiff());
        assertTrue(config.isQuiet());
    }

    @Test
    void logFileMayBeASeparateArgument() {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--log-file", "run.log"})
            .build();

        assertEquals(Path.of("run.log").toAbsolutePath().normalize(), config.getLogFile());
    }

    @Test
    void collectsUnknownArguments() {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"a.ini", "b.ini", "--verbose"})
            .build();

        assertEquals(List.of("b.ini", "--verbose"), config.getIgnoredArgs());
    }
}
