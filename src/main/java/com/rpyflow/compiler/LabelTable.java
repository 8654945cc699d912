package com.rpyflow.compiler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Global node id to label table. Every label is owned by at most one node; reserved labels
 * (start and end) are owned by none.
 */
public class LabelTable {
    private static final String RESERVED = "";

    private final Map<String, String> labelsByNode = new HashMap<>();
    private final Map<String, String> ownersByLabel = new HashMap<>();

    public void reserve(String label) {
        ownersByLabel.putIfAbsent(label, RESERVED);
    }

    public void register(String nodeId, String label) {
        if (labelsByNode.containsKey(nodeId)) {
            throw new IllegalStateException("Node compiled twice: " + nodeId);
        }
        String owner = ownersByLabel.get(label);
        if (owner != null) {
            String usedBy = RESERVED.equals(owner) ? "the generated entry or end block" : "node " + owner;
            throw new CompilationException(nodeId,
                "Label \"" + label + "\" of node " + nodeId + " is already used by " + usedBy);
        }
        ownersByLabel.put(label, nodeId);
        labelsByNode.put(nodeId, label);
    }

    public Optional<String> lookup(String nodeId) {
        return Optional.ofNullable(labelsByNode.get(nodeId));
    }

    public boolean isRegistered(String nodeId) {
        return labelsByNode.containsKey(nodeId);
    }

    public int size() {
        return labelsByNode.size();
    }
}
