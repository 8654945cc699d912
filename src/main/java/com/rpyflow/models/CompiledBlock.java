package com.rpyflow.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A labelled Ren'Py block produced for one node. Immutable.
 */
public final class CompiledBlock {
    private final String label;
    private final String nodeId;
    private final List<ScriptLine> lines;

    public CompiledBlock(String label, String nodeId, List<ScriptLine> lines) {
        this.label = label;
        this.nodeId = nodeId;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public String getLabel() {
        return label;
    }

    /** Id of the source node, null for the entry and end blocks of the base file. */
    public String getNodeId() {
        return nodeId;
    }

    public List<ScriptLine> getLines() {
        return lines;
    }

    public Set<String> getJumpTargets() {
        Set<String> targets = new LinkedHashSet<>();
        for (ScriptLine line : lines) {
            if (line.isDeferredJump()) {
                targets.add(line.jumpTargetId());
            }
        }
        return targets;
    }
}
