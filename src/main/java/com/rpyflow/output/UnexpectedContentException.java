package com.rpyflow.output;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The target directory holds something this tool did not generate. Raised before anything is
 * deleted.
 */
public class UnexpectedContentException extends IOException {
    private final Path targetDir;
    private final String entryName;

    public UnexpectedContentException(Path targetDir, String entryName, String message) {
        super(message);
        this.targetDir = targetDir;
        this.entryName = entryName;
    }

    public Path getTargetDir() {
        return targetDir;
    }

    public String getEntryName() {
        return entryName;
    }
}
