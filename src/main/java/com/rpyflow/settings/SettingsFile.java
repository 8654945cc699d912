package com.rpyflow.settings;

import com.rpyflow.AppLogger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads an ini-style settings file into {@link CompilerSettings}.
 * <p>
 * Lines are {@code key = value} (or {@code key: value}); {@code #} and {@code ;} start comment lines and
 * {@code [Section]} headers are ignored, so every key lives in one flat namespace. Relative paths
 * resolve against the directory of the settings file.
 */
public final class SettingsFile {

    private SettingsFile() {}

    public static CompilerSettings load(Path settingsFile) throws IOException {
        if (!Files.exists(settingsFile)) {
            throw new FileNotFoundException("Settings file not found: " + settingsFile);
        }
        String content = new String(Files.readAllBytes(settingsFile), StandardCharsets.UTF_8);
        Path baseDir = settingsFile.toAbsolutePath().getParent();
        return fromValues(parse(content), baseDir);
    }

    public static Map<String, String> parse(String content) {
        Map<String, String> values = new LinkedHashMap<>();
        if (content == null) {
            return values;
        }
        String[] lines = content.replace("\r\n", "\n").replace('\r', '\n').split("\n");
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                continue;
            }
            int sep = separatorIndex(line);
            if (sep <= 0) {
                log("Ignoring malformed settings line: " + line);
                continue;
            }
            String key = line.substring(0, sep).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(sep + 1).trim();
            values.put(key, value);
        }
        return values;
    }

    public static CompilerSettings fromValues(Map<String, String> values, Path baseDir) {
        CompilerSettings.Builder b = new CompilerSettings.Builder();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            switch (key) {
                case "path_articy_json":
                    b.pathArticyJson(resolve(baseDir, value));
                    break;
                case "path_target_dir":
                    b.pathTargetDir(resolve(baseDir, value));
                    break;
                case "file_prefix":
                    b.filePrefix(value);
                    break;
                case "base_file_name":
                    b.baseFileName(value);
                    break;
                case "variables_file_name":
                    b.variablesFileName(value);
                    break;
                case "characters_file_name":
                    b.charactersFileName(value);
                    break;
                case "log_file_name":
                    b.logFileName(value);
                    break;
                case "character_prefix":
                    b.characterPrefix(value);
                    break;
                case "label_prefix":
                    b.labelPrefix(value);
                    break;
                case "start_label":
                    b.startLabel(value);
                    break;
                case "end_label":
                    b.endLabel(value);
                    break;
                case "start_node":
                    b.startNode(value);
                    break;
                case "menu_display_text_box":
                    b.menuDisplayTextBox(parseBoolean(key, value));
                    break;
                case "markdown_text_styles":
                    b.markdownTextStyles(parseBoolean(key, value));
                    break;
                case "relative_imgs_in_braces":
                    b.relativeImgsInBraces(parseBoolean(key, value));
                    break;
                case "beginnings_log_lines":
                    b.beginningsLogLines(splitList(value));
                    break;
                case "repeat_menu_text":
                    b.repeatMenuText(parseBoolean(key, value));
                    break;
                case "features_renpy_character_params":
                    b.featuresRenpyCharacterParams(splitList(value));
                    break;
                case "renpy_character_name":
                    b.renpyCharacterName(value);
                    break;
                case "renpy_box":
                    b.renpyBox(splitList(value));
                    break;
                case "renpy_entry_point":
                    b.renpyEntryPoint(splitList(value));
                    break;
                default:
                    log("Ignoring unknown setting: " + key);
            }
        }
        return b.build();
    }

    static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Setting " + key + " must be True or False, got: " + value);
    }

    /**
     * Splits a comma separated value, dropping empty entries.
     */
    static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    private static int separatorIndex(String line) {
        int eq = line.indexOf('=');
        int colon = line.indexOf(':');
        if (eq < 0) return colon;
        if (colon < 0) return eq;
        return Math.min(eq, colon);
    }

    private static Path resolve(Path baseDir, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        // Exports made on Windows keep their backslashes
        Path path = Path.of(value.replace('\\', '/'));
        if (path.isAbsolute() || baseDir == null) {
            return path.normalize();
        }
        return baseDir.resolve(path).normalize();
    }

    private static void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[SettingsFile] " + message);
        }
    }
}
