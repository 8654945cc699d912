package com.rpyflow;

import com.rpyflow.models.Diagnostic;
import com.rpyflow.models.FileUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects compile-time diagnostics keyed by output file, in discovery order, and renders
 * them as the grouped report written next to the generated scripts.
 */
public class LogAggregator {

    private final Map<String, List<Diagnostic>> byFile = new LinkedHashMap<>();
    private final List<Diagnostic> all = new ArrayList<>();

    public void report(String filePath, String label, String message) {
        Diagnostic diagnostic = new Diagnostic(filePath, label, message);
        byFile.computeIfAbsent(filePath, key -> new ArrayList<>()).add(diagnostic);
        all.add(diagnostic);
    }

    /**
     * Returns a reporter bound to one file and, optionally, one node label.
     */
    public Scope scope(String filePath, String label) {
        return new Scope(filePath, label);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(all);
    }

    public List<Diagnostic> getDiagnostics(String filePath) {
        List<Diagnostic> list = byFile.get(filePath);
        return list != null ? Collections.unmodifiableList(list) : List.of();
    }

    public int size() {
        return all.size();
    }

    public boolean isEmpty() {
        return all.isEmpty();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<Diagnostic>> entry : byFile.entrySet()) {
            sb.append(entry.getKey()).append('\n');
            for (Diagnostic diagnostic : entry.getValue()) {
                sb.append(FileUnit.INDENT).append(diagnostic.format()).append('\n');
            }
        }
        return sb.toString();
    }

    public final class Scope {
        private final String filePath;
        private final String label;

        private Scope(String filePath, String label) {
            this.filePath = filePath;
            this.label = label;
        }

        public void report(String message) {
            LogAggregator.this.report(filePath, label, message);
        }

        public String getLabel() {
            return label;
        }
    }
}
