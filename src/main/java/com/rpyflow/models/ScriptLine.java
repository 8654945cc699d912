package com.rpyflow.models;

/**
 * One statement of a compiled block. A line with a jump target renders as {@code jump <label>},
 * the label being looked up only once every node of the flow has been compiled.
 */
public record ScriptLine(int depth, String text, String jumpTargetId) {

    public static ScriptLine of(int depth, String text) {
        return new ScriptLine(depth, text, null);
    }

    public static ScriptLine jump(int depth, String targetNodeId) {
        return new ScriptLine(depth, null, targetNodeId);
    }

    public boolean isDeferredJump() {
        return jumpTargetId != null;
    }

    public ScriptLine indented(int extra) {
        return new ScriptLine(depth + extra, text, jumpTargetId);
    }
}
