package com.rpyflow.compiler;

/**
 * A structural problem in the flow that stops the whole compilation.
 */
public class CompilationException extends RuntimeException {
    private final String nodeId;

    public CompilationException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    /** Id of the offending node, null when the problem is not tied to one node. */
    public String getNodeId() {
        return nodeId;
    }
}
