package com.rpyflow.models;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FileUnitTest {

    @Test
    void rendersHeaderBlocksAndResolvedJumps() {
        FileUnit unit = new FileUnit("chapter_1", "articy_chapter_1.rpy", "Chapter 1");
        CompiledBlock block = new CompiledBlock("label_a", "a", List.of(
            ScriptLine.of(1, "\"Hello!\""),
            ScriptLine.jump(1, "b")));
        unit.append(block);
        unit.close();

        String text = unit.render((from, target) -> "label_" + target);

        assertEquals("# Chapter 1\n\nlabel label_a:\n    \"Hello!\"\n    jump label_b\n\n", text);
        assertEquals("chapter_1", unit.getDirectory());
        assertEquals("chapter_1/articy_chapter_1.rpy", unit.getPath());
        assertEquals(List.of(block), unit.getBlocks());
        assertEquals(Set.of("b"), block.getJumpTargets());
    }

    @Test
    void closedUnitRejectsBlocks() {
        FileUnit unit = new FileUnit("", "articy_start.rpy", null);
        unit.close();

        assertTrue(unit.isClosed());
        assertThrows(IllegalStateException.class,
            () -> unit.append(new CompiledBlock("start", null, List.of(ScriptLine.of(1, "return")))));
    }
}
