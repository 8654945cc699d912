package com.rpyflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogAggregatorTest {

    @Test
    void rendersDiagnosticsGroupedByFile() {
        LogAggregator log = new LogAggregator();
        log.report("chapter_1/articy_chapter_1.rpy", "label_a", "contains the following line: # TODO");
        log.report("chapter_2/articy_chapter_2.rpy", null, "Type \"Flag\" of model x is not supported");
        log.scope("chapter_1/articy_chapter_1.rpy", "label_b")
            .report("was not assigned any jump target in Articy, will jump to \"end\"");

        assertEquals(
            "chapter_1/articy_chapter_1.rpy\n"
                + "    label_a contains the following line: # TODO\n"
                + "    label_b was not assigned any jump target in Articy, will jump to \"end\"\n"
                + "chapter_2/articy_chapter_2.rpy\n"
                + "    Type \"Flag\" of model x is not supported\n",
            log.render());
        assertEquals(3, log.size());
        assertEquals(2, log.getDiagnostics("chapter_1/articy_chapter_1.rpy").size());
        assertEquals("chapter_2/articy_chapter_2.rpy", log.getDiagnostics().get(1).getFilePath());
    }

    @Test
    void keepsDuplicates() {
        LogAggregator log = new LogAggregator();
        log.report("a.rpy", "l", "same");
        log.report("a.rpy", "l", "same");

        assertEquals(2, log.getDiagnostics("a.rpy").size());
    }

    @Test
    void emptyLogRendersNothing() {
        LogAggregator log = new LogAggregator();

        assertTrue(log.isEmpty());
        assertEquals("", log.render());
        assertTrue(log.getDiagnostics("missing.rpy").isEmpty());
    }
}
