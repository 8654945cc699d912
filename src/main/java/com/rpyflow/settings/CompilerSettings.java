package com.rpyflow.settings;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable compiler settings. Every option except the two paths has a default.
 */
public class CompilerSettings {

    private final Path pathArticyJson;
    private final Path pathTargetDir;
    private final String filePrefix;
    private final String baseFileName;
    private final String variablesFileName;
    private final String charactersFileName;
    private final String logFileName;
    private final String characterPrefix;
    private final String labelPrefix;
    private final String startLabel;
    private final String endLabel;
    private final String startNode;
    private final boolean menuDisplayTextBox;
    private final boolean markdownTextStyles;
    private final boolean relativeImgsInBraces;
    private final List<String> beginningsLogLines;
    private final boolean repeatMenuText;
    private final List<String> featuresRenpyCharacterParams;
    private final String renpyCharacterName;
    private final List<String> renpyBox;
    private final List<String> renpyEntryPoint;

    private CompilerSettings(Builder b) {
        this.pathArticyJson = b.pathArticyJson;
        this.pathTargetDir = b.pathTargetDir;
        this.filePrefix = b.filePrefix;
        this.baseFileName = b.baseFileName;
        this.variablesFileName = b.variablesFileName;
        this.charactersFileName = b.charactersFileName;
        this.logFileName = b.logFileName;
        this.characterPrefix = b.characterPrefix;
        this.labelPrefix = b.labelPrefix;
        this.startLabel = b.startLabel;
        this.endLabel = b.endLabel;
        this.startNode = b.startNode;
        this.menuDisplayTextBox = b.menuDisplayTextBox;
        this.markdownTextStyles = b.markdownTextStyles;
        this.relativeImgsInBraces = b.relativeImgsInBraces;
        this.beginningsLogLines = Collections.unmodifiableList(new ArrayList<>(b.beginningsLogLines));
        this.repeatMenuText = b.repeatMenuText;
        this.featuresRenpyCharacterParams = Collections.unmodifiableList(new ArrayList<>(b.featuresRenpyCharacterParams));
        this.renpyCharacterName = b.renpyCharacterName;
        this.renpyBox = Collections.unmodifiableList(new ArrayList<>(b.renpyBox));
        this.renpyEntryPoint = Collections.unmodifiableList(new ArrayList<>(b.renpyEntryPoint));
    }

    public Path getPathArticyJson() { return pathArticyJson; }
    public Path getPathTargetDir() { return pathTargetDir; }
    public String getFilePrefix() { return filePrefix; }
    public String getBaseFileName() { return baseFileName; }
    public String getVariablesFileName() { return variablesFileName; }
    public String getCharactersFileName() { return charactersFileName; }
    public String getLogFileName() { return logFileName; }
    public String getCharacterPrefix() { return characterPrefix; }
    public String getLabelPrefix() { return labelPrefix; }
    public String getStartLabel() { return startLabel; }
    public String getEndLabel() { return endLabel; }
    public String getStartNode() { return startNode; }
    public boolean isMenuDisplayTextBox() { return menuDisplayTextBox; }
    public boolean isMarkdownTextStyles() { return markdownTextStyles; }
    public boolean isRelativeImgsInBraces() { return relativeImgsInBraces; }
    public List<String> getBeginningsLogLines() { return beginningsLogLines; }
    public boolean isRepeatMenuText() { return repeatMenuText; }
    public List<String> getFeaturesRenpyCharacterParams() { return featuresRenpyCharacterParams; }
    public String getRenpyCharacterName() { return renpyCharacterName; }
    public List<String> getRenpyBox() { return renpyBox; }
    public List<String> getRenpyEntryPoint() { return renpyEntryPoint; }

    /** Name of a fixed file at the target root, with the generated-file prefix applied. */
    public String prefixed(String fileName) {
        return filePrefix + fileName;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.pathArticyJson = pathArticyJson;
        b.pathTargetDir = pathTargetDir;
        b.filePrefix = filePrefix;
        b.baseFileName = baseFileName;
        b.variablesFileName = variablesFileName;
        b.charactersFileName = charactersFileName;
        b.logFileName = logFileName;
        b.characterPrefix = characterPrefix;
        b.labelPrefix = labelPrefix;
        b.startLabel = startLabel;
        b.endLabel = endLabel;
        b.startNode = startNode;
        b.menuDisplayTextBox = menuDisplayTextBox;
        b.markdownTextStyles = markdownTextStyles;
        b.relativeImgsInBraces = relativeImgsInBraces;
        b.beginningsLogLines = new ArrayList<>(beginningsLogLines);
        b.repeatMenuText = repeatMenuText;
        b.featuresRenpyCharacterParams = new ArrayList<>(featuresRenpyCharacterParams);
        b.renpyCharacterName = renpyCharacterName;
        b.renpyBox = new ArrayList<>(renpyBox);
        b.renpyEntryPoint = new ArrayList<>(renpyEntryPoint);
        return b;
    }

    /**
     * Builder for CompilerSettings.
     */
    public static class Builder {
        private Path pathArticyJson;
        private Path pathTargetDir;
        private String filePrefix = "articy_";
        private String baseFileName = "start.rpy";
        private String variablesFileName = "variables.rpy";
        private String charactersFileName = "characters.rpy";
        private String logFileName = "log.txt";
        private String characterPrefix = "character.";
        private String labelPrefix = "label_";
        private String startLabel = "start";
        private String endLabel = "end";
        private String startNode = "";
        private boolean menuDisplayTextBox = true;
        private boolean markdownTextStyles = false;
        private boolean relativeImgsInBraces = false;
        private List<String> beginningsLogLines = List.of("# todo", "#todo");
        private boolean repeatMenuText = false;
        private List<String> featuresRenpyCharacterParams = List.of("RenPyCharacterParams");
        private String renpyCharacterName = "RenPyCharacterName";
        private List<String> renpyBox = List.of("RenPyBox");
        private List<String> renpyEntryPoint = List.of("RenPyEntryPoint");

        public Builder pathArticyJson(Path path) { this.pathArticyJson = path; return this; }
        public Builder pathTargetDir(Path path) { this.pathTargetDir = path; return this; }
        public Builder filePrefix(String value) { this.filePrefix = value; return this; }
        public Builder baseFileName(String value) { this.baseFileName = value; return this; }
        public Builder variablesFileName(String value) { this.variablesFileName = value; return this; }
        public Builder charactersFileName(String value) { this.charactersFileName = value; return this; }
        public Builder logFileName(String value) { this.logFileName = value; return this; }
        public Builder characterPrefix(String value) { this.characterPrefix = value; return this; }
        public Builder labelPrefix(String value) { this.labelPrefix = value; return this; }
        public Builder startLabel(String value) { this.startLabel = value; return this; }
        public Builder endLabel(String value) { this.endLabel = value; return this; }
        public Builder startNode(String value) { this.startNode = value; return this; }
        public Builder menuDisplayTextBox(boolean value) { this.menuDisplayTextBox = value; return this; }
        public Builder markdownTextStyles(boolean value) { this.markdownTextStyles = value; return this; }
        public Builder relativeImgsInBraces(boolean value) { this.relativeImgsInBraces = value; return this; }
        public Builder beginningsLogLines(List<String> value) { this.beginningsLogLines = value; return this; }
        public Builder repeatMenuText(boolean value) { this.repeatMenuText = value; return this; }
        public Builder featuresRenpyCharacterParams(List<String> value) { this.featuresRenpyCharacterParams = value; return this; }
        public Builder renpyCharacterName(String value) { this.renpyCharacterName = value; return this; }
        public Builder renpyBox(List<String> value) { this.renpyBox = value; return this; }
        public Builder renpyEntryPoint(List<String> value) { this.renpyEntryPoint = value; return this; }

        public CompilerSettings build() {
            if (pathArticyJson == null) {
                throw new IllegalArgumentException("Missing required setting: path_articy_json");
            }
            if (pathTargetDir == null) {
                throw new IllegalArgumentException("Missing required setting: path_target_dir");
            }
            if (labelPrefix == null || endLabel == null || endLabel.isBlank() || startLabel == null || startLabel.isBlank()) {
                throw new IllegalArgumentException("label_prefix, start_label and end_label must be set");
            }
            Set<String> rootFiles = new HashSet<>(Arrays.asList(baseFileName, variablesFileName, charactersFileName, logFileName));
            if (rootFiles.size() < 4) {
                throw new IllegalArgumentException(
                    "base_file_name, variables_file_name, characters_file_name and log_file_name must differ");
            }
            return new CompilerSettings(this);
        }
    }
}
