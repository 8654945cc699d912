package com.rpyflow.models;

/**
 * A compile-time finding reported against an output file. Never aborts compilation.
 */
public final class Diagnostic {
    private final String filePath;
    private final String label;
    private final String message;

    public Diagnostic(String filePath, String label, String message) {
        this.filePath = filePath;
        this.label = label;
        this.message = message;
    }

    public String getFilePath() {
        return filePath;
    }

    public String getLabel() {
        return label;
    }

    public String getMessage() {
        return message;
    }

    /** The report line: the message, prefixed by the node label when known. */
    public String format() {
        if (label == null || label.isEmpty()) {
            return message;
        }
        return label + " " + message;
    }

    @Override
    public String toString() {
        return filePath + ": " + format();
    }
}
