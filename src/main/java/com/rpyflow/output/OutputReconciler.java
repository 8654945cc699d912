package com.rpyflow.output;

import com.rpyflow.AppLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Replaces the previous generation in the target directory with a new one. Nothing is deleted
 * unless every entry of the directory looks generated.
 */
public class OutputReconciler {

    private final Path targetDir;
    private final String filePrefix;

    public OutputReconciler(Path targetDir, String filePrefix) {
        this.targetDir = targetDir;
        this.filePrefix = filePrefix;
    }

    /**
     * Decides whether a directory holding {@code entries} may be cleared.
     */
    public static ReconcileDecision assess(List<DirectoryEntry> entries, OutputFootprint footprint) {
        for (DirectoryEntry entry : entries) {
            if (footprint.accepts(entry)) {
                continue;
            }
            if (entry.directory()) {
                return ReconcileDecision.abort(entry.name(), "Did not expect directory \"" + entry.name() + "\"");
            }
            return ReconcileDecision.abort(entry.name(), "Did not expect file \"" + entry.name()
                + "\" without prefix \"" + footprint.getFilePrefix() + "\"");
        }
        return ReconcileDecision.proceed();
    }

    /**
     * Clears the previous generation and writes {@code tree}.
     *
     * @throws UnexpectedContentException if the directory holds anything not generated by this tool;
     *                                    nothing has been deleted in that case
     * @throws IOException                if the target is not a directory or the filesystem fails
     */
    public Report reconcile(GeneratedTree tree) throws IOException {
        boolean created = false;
        if (!Files.exists(targetDir)) {
            Files.createDirectories(targetDir);
            created = true;
            log("Created target directory " + targetDir);
        } else if (!Files.isDirectory(targetDir)) {
            throw new IOException("Target path is not a directory: " + targetDir);
        }

        List<Path> children = listChildren();
        List<DirectoryEntry> entries = new ArrayList<>();
        for (Path child : children) {
            entries.add(new DirectoryEntry(child.getFileName().toString(), Files.isDirectory(child)));
        }
        ReconcileDecision decision = assess(entries, new OutputFootprint(filePrefix, tree.getTopLevelDirectories()));
        if (!decision.isProceed()) {
            throw new UnexpectedContentException(targetDir, decision.getOffendingEntry(),
                decision.getReason() + " in directory " + targetDir);
        }

        Map<String, String> previous = snapshot(extensionsOf(tree.getFiles().keySet()));
        for (Path child : children) {
            delete(child);
        }
        for (Map.Entry<String, String> file : tree.getFiles().entrySet()) {
            Path path = targetDir.resolve(file.getKey()).normalize();
            if (!path.startsWith(targetDir.normalize())) {
                throw new IOException("Generated path escapes the target directory: " + file.getKey());
            }
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, file.getValue(), StandardCharsets.UTF_8);
        }
        log("Wrote " + tree.size() + " file(s) to " + targetDir);
        return new Report(created, children.size(), tree.size(), GenerationDiff.compare(previous, tree.getFiles()));
    }

    private List<Path> listChildren() throws IOException {
        try (Stream<Path> list = Files.list(targetDir)) {
            List<Path> children = new ArrayList<>();
            list.sorted().forEach(children::add);
            return children;
        }
    }

    /**
     * Text of every file currently under the target directory, keyed by forward-slash relative path.
     */
    Map<String, String> snapshot() throws IOException {
        return snapshot(null);
    }

    /**
     * Text of the files a generation could have written: those with one of {@code extensions}
     * (all files when null) that decode as UTF-8. Byte-compiled scripts and other binaries are skipped.
     */
    Map<String, String> snapshot(Set<String> extensions) throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        try (Stream<Path> walk = Files.walk(targetDir)) {
            List<Path> paths = new ArrayList<>();
            walk.filter(Files::isRegularFile).sorted().forEach(paths::add);
            for (Path path : paths) {
                String relative = targetDir.relativize(path).toString().replace('\\', '/');
                if (extensions != null && !extensions.contains(extensionOf(relative))) {
                    continue;
                }
                String text = readText(path);
                if (text != null) {
                    files.put(relative, text);
                }
            }
        }
        return files;
    }

    /**
     * @return the UTF-8 content of {@code path}, or null when it is not valid UTF-8
     */
    private String readText(Path path) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(Files.readAllBytes(path))).toString();
        } catch (CharacterCodingException e) {
            log("Not comparing " + targetDir.relativize(path) + ": not a UTF-8 text file");
            return null;
        }
    }

    static Set<String> extensionsOf(Collection<String> paths) {
        Set<String> extensions = new HashSet<>();
        for (String path : paths) {
            extensions.add(extensionOf(path));
        }
        return extensions;
    }

    private static String extensionOf(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    private void delete(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            Files.delete(path);
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder())
                .forEach(p -> {
                    try {
                        Files.delete(p);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to delete: " + p, e);
                    }
                });
        } catch (UncheckedIOException e) {
            throw new IOException(e.getMessage(), e.getCause());
        }
    }

    private void log(String message) {
        if (AppLogger.get() != null) {
            AppLogger.get().info(message);
        }
    }

    /**
     * What a reconciliation did.
     */
    public static class Report {
        private final boolean createdTargetDir;
        private final int deletedEntries;
        private final int writtenFiles;
        private final GenerationDiff diff;

        Report(boolean createdTargetDir, int deletedEntries, int writtenFiles, GenerationDiff diff) {
            this.createdTargetDir = createdTargetDir;
            this.deletedEntries = deletedEntries;
            this.writtenFiles = writtenFiles;
            this.diff = diff;
        }

        public boolean isCreatedTargetDir() {
            return createdTargetDir;
        }

        public int getDeletedEntries() {
            return deletedEntries;
        }

        public int getWrittenFiles() {
            return writtenFiles;
        }

        public GenerationDiff getDiff() {
            return diff;
        }
    }
}
