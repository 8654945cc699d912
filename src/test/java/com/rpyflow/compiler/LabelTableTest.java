package com.rpyflow.compiler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LabelTableTest {

    @Test
    void registersAndLooksUpLabels() {
        LabelTable labels = new LabelTable();
        labels.register("d1", "label_d1");

        assertEquals("label_d1", labels.lookup("d1").orElse(null));
        assertTrue(labels.lookup("d2").isEmpty());
        assertTrue(labels.isRegistered("d1"));
        assertEquals(1, labels.size());
    }

    @Test
    void rejectsLabelOwnedByAnotherNode() {
        LabelTable labels = new LabelTable();
        labels.register("d1", "intro");

        CompilationException e = assertThrows(CompilationException.class, () -> labels.register("d2", "intro"));
        assertEquals("d2", e.getNodeId());
        assertEquals("Label \"intro\" of node d2 is already used by node d1", e.getMessage());
    }

    @Test
    void rejectsReservedLabels() {
        LabelTable labels = new LabelTable();
        labels.reserve("start");

        CompilationException e = assertThrows(CompilationException.class, () -> labels.register("d1", "start"));
        assertTrue(e.getMessage().contains("the generated entry or end block"));
    }

    @Test
    void compilingANodeTwiceIsABug() {
        LabelTable labels = new LabelTable();
        labels.register("d1", "label_d1");

        assertThrows(IllegalStateException.class, () -> labels.register("d1", "other"));
    }
}
