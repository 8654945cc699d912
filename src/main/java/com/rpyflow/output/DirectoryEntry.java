package com.rpyflow.output;

/**
 * An immediate child of the target directory.
 */
public record DirectoryEntry(String name, boolean directory) {

    public static DirectoryEntry file(String name) {
        return new DirectoryEntry(name, false);
    }

    public static DirectoryEntry directory(String name) {
        return new DirectoryEntry(name, true);
    }
}
