package com.rpyflow.models;

/**
 * How the compiler treats a node of the flow graph.
 */
public enum NodeKind {
    /** Groups child nodes; becomes one directory and one script file. */
    CONTAINER,
    /** Spoken or narrated line with speaker, text and menu text. */
    DIALOGUE,
    /** Text field is emitted as literal Ren'Py statements. */
    RAW_CODE,
    HUB,
    JUMP,
    CONDITION,
    INSTRUCTION,
    /** Raw-code template whose text names the label of its block. */
    ENTRY_POINT,
    COMMENT,
    UNSUPPORTED;

    public boolean isContainer() {
        return this == CONTAINER;
    }
}
