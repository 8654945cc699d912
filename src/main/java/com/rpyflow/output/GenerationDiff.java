package com.rpyflow.output;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Line-level comparison of the previous generation with the new one.
 */
public class GenerationDiff {

    public enum Status { ADDED, REMOVED, CHANGED, UNCHANGED }

    private final List<FileChange> changes;

    private GenerationDiff(List<FileChange> changes) {
        this.changes = Collections.unmodifiableList(changes);
    }

    /**
     * Compares two generations keyed by relative path. Paths are visited in sorted order.
     */
    public static GenerationDiff compare(Map<String, String> previous, Map<String, String> next) {
        TreeSet<String> paths = new TreeSet<>(previous.keySet());
        paths.addAll(next.keySet());
        List<FileChange> changes = new ArrayList<>();
        for (String path : paths) {
            List<String> original = lines(previous.get(path));
            List<String> revised = lines(next.get(path));
            Patch<String> patch = DiffUtils.diff(original, revised);
            int added = 0;
            int removed = 0;
            for (AbstractDelta<String> delta : patch.getDeltas()) {
                added += delta.getTarget().size();
                removed += delta.getSource().size();
            }
            Status status;
            if (!previous.containsKey(path)) {
                status = Status.ADDED;
            } else if (!next.containsKey(path)) {
                status = Status.REMOVED;
            } else if (patch.getDeltas().isEmpty()) {
                status = Status.UNCHANGED;
            } else {
                status = Status.CHANGED;
            }
            String unified = status == Status.UNCHANGED ? "" : String.join("\n",
                UnifiedDiffUtils.generateUnifiedDiff(path, path, original, patch, 3));
            changes.add(new FileChange(path, status, added, removed, unified));
        }
        return new GenerationDiff(changes);
    }

    private static List<String> lines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(List.of(content.split("\n", -1)));
        if (content.endsWith("\n")) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    public List<FileChange> getChanges() {
        return changes;
    }

    public List<FileChange> getChanges(Status status) {
        List<FileChange> result = new ArrayList<>();
        for (FileChange change : changes) {
            if (change.status() == status) {
                result.add(change);
            }
        }
        return result;
    }

    public boolean hasChanges() {
        return changes.stream().anyMatch(change -> change.status() != Status.UNCHANGED);
    }

    /**
     * One line per file that is not unchanged, e.g. {@code ~ chapter_1/articy_chapter_1.rpy (+2 -1)}.
     */
    public List<String> summary() {
        List<String> lines = new ArrayList<>();
        for (FileChange change : changes) {
            switch (change.status()) {
                case ADDED:
                    lines.add("+ " + change.path() + " (+" + change.addedLines() + ")");
                    break;
                case REMOVED:
                    lines.add("- " + change.path() + " (-" + change.removedLines() + ")");
                    break;
                case CHANGED:
                    lines.add("~ " + change.path() + " (+" + change.addedLines() + " -" + change.removedLines() + ")");
                    break;
                default:
                    break;
            }
        }
        return lines;
    }

    public String unifiedDiff() {
        StringBuilder sb = new StringBuilder();
        for (FileChange change : changes) {
            if (!change.unifiedDiff().isEmpty()) {
                sb.append(change.unifiedDiff()).append('\n');
            }
        }
        return sb.toString();
    }

    public record FileChange(String path, Status status, int addedLines, int removedLines, String unifiedDiff) {}
}
