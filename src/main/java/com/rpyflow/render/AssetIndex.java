package com.rpyflow.render;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Relative paths of the files under the Ren'Py {@code game} directory. A disabled index
 * accepts every reference.
 */
public class AssetIndex {

    private final Path gameDir;
    private final Set<String> paths;

    private AssetIndex(Path gameDir, Set<String> paths) {
        this.gameDir = gameDir;
        this.paths = paths;
    }

    public static AssetIndex disabled() {
        return new AssetIndex(null, null);
    }

    public static AssetIndex of(Collection<String> relativePaths) {
        return new AssetIndex(null, Collections.unmodifiableSet(new TreeSet<>(relativePaths)));
    }

    /**
     * Indexes the closest ancestor of {@code targetDir} named {@code game}.
     * Returns a disabled index when there is none.
     */
    public static AssetIndex forTargetDir(Path targetDir) throws IOException {
        Path gameDir = findGameDir(targetDir);
        if (gameDir == null || !Files.isDirectory(gameDir)) {
            return disabled();
        }
        try (Stream<Path> walk = Files.walk(gameDir)) {
            Set<String> paths = walk
                .filter(Files::isRegularFile)
                .map(p -> gameDir.relativize(p).toString().replace('\\', '/'))
                .collect(Collectors.toCollection(TreeSet::new));
            return new AssetIndex(gameDir, Collections.unmodifiableSet(paths));
        }
    }

    static Path findGameDir(Path targetDir) {
        if (targetDir == null) {
            return null;
        }
        Path current = targetDir.toAbsolutePath().normalize().getParent();
        while (current != null) {
            Path name = current.getFileName();
            if (name != null && "game".equals(name.toString())) {
                return current;
            }
            current = current.getParent();
        }
        return null;
    }

    public boolean isEnabled() {
        return paths != null;
    }

    public Path getGameDir() {
        return gameDir;
    }

    public boolean contains(String relativePath) {
        if (paths == null) {
            return true;
        }
        String normalized = relativePath.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return paths.contains(normalized);
    }

    public int size() {
        return paths != null ? paths.size() : 0;
    }
}
