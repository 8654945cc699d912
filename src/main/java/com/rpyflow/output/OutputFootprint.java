package com.rpyflow.output;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What a previous generation may have left in the target directory: files carrying the generated
 * prefix and the directories of the current top-level containers.
 */
public class OutputFootprint {
    private final String filePrefix;
    private final Set<String> expectedDirectories;

    public OutputFootprint(String filePrefix, Collection<String> expectedDirectories) {
        this.filePrefix = filePrefix != null ? filePrefix : "";
        this.expectedDirectories = Collections.unmodifiableSet(new LinkedHashSet<>(expectedDirectories));
    }

    public String getFilePrefix() {
        return filePrefix;
    }

    public boolean accepts(DirectoryEntry entry) {
        if (entry.directory()) {
            return expectedDirectories.contains(entry.name());
        }
        return entry.name().startsWith(filePrefix);
    }
}
