package com.rpyflow.output;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The complete output of one compilation, held in memory until it is written: file contents
 * keyed by forward-slash path relative to the target directory, plus the directories created
 * for top-level containers.
 */
public class GeneratedTree {
    private final Map<String, String> files = new LinkedHashMap<>();
    private final Set<String> topLevelDirectories = new LinkedHashSet<>();

    public GeneratedTree addFile(String path, String content) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("File path is required");
        }
        if (path.startsWith("/") || List.of(path.split("/")).contains("..")) {
            throw new IllegalArgumentException("File path must stay inside the target directory: " + path);
        }
        if (files.putIfAbsent(path, content != null ? content : "") != null) {
            throw new IllegalArgumentException("Duplicate generated file: " + path);
        }
        return this;
    }

    public GeneratedTree addTopLevelDirectory(String name) {
        topLevelDirectories.add(name);
        return this;
    }

    public Map<String, String> getFiles() {
        return Collections.unmodifiableMap(files);
    }

    public String getFile(String path) {
        return files.get(path);
    }

    public boolean hasFile(String path) {
        return files.containsKey(path);
    }

    public Set<String> getTopLevelDirectories() {
        return Collections.unmodifiableSet(topLevelDirectories);
    }

    public int size() {
        return files.size();
    }
}
