package com.rpyflow.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputReconcilerTest {

    @TempDir
    Path tempDir;

    private GeneratedTree tree(String chapterContent, boolean withScene) {
        GeneratedTree tree = new GeneratedTree()
            .addFile("articy_start.rpy", "label start:\n    jump end\n")
            .addFile("chapter_1/articy_chapter_1.rpy", chapterContent)
            .addFile("articy_log.txt", "")
            .addTopLevelDirectory("chapter_1");
        if (withScene) {
            tree.addFile("chapter_1/scene/articy_scene.rpy", "label label_s:\n    return\n");
        }
        return tree;
    }

    @Test
    void assessAcceptsPreviousGeneration() {
        OutputFootprint footprint = new OutputFootprint("articy_", List.of("chapter_1"));

        ReconcileDecision decision = OutputReconciler.assess(List.of(
            DirectoryEntry.file("articy_start.rpy"),
            DirectoryEntry.file("articy_log.txt"),
            DirectoryEntry.directory("chapter_1")), footprint);

        assertTrue(decision.isProceed());
    }

    @Test
    void assessRejectsForeignFilesAndDirectories() {
        OutputFootprint footprint = new OutputFootprint("articy_", List.of("chapter_1"));

        ReconcileDecision file = OutputReconciler.assess(List.of(
            DirectoryEntry.file("articy_start.rpy"), DirectoryEntry.file("script.rpy")), footprint);
        ReconcileDecision dir = OutputReconciler.assess(List.of(DirectoryEntry.directory("images")), footprint);
        ReconcileDecision prefixedDir = OutputReconciler.assess(List.of(DirectoryEntry.directory("articy_old")), footprint);

        assertFalse(file.isProceed());
        assertEquals("script.rpy", file.getOffendingEntry());
        assertFalse(dir.isProceed());
        assertEquals("images", dir.getOffendingEntry());
        assertFalse(prefixedDir.isProceed());
    }

    @Test
    void createsMissingTargetAndWritesTree() throws IOException {
        Path target = tempDir.resolve("game").resolve("articy");
        OutputReconciler reconciler = new OutputReconciler(target, "articy_");

        OutputReconciler.Report report = reconciler.reconcile(tree("label label_c1:\n    jump end\n", true));

        assertTrue(report.isCreatedTargetDir());
        assertEquals(4, report.getWrittenFiles());
        assertEquals("label label_c1:\n    jump end\n",
            Files.readString(target.resolve("chapter_1/articy_chapter_1.rpy")));
        assertTrue(Files.exists(target.resolve("chapter_1/scene/articy_scene.rpy")));
        assertEquals(4, report.getDiff().getChanges(GenerationDiff.Status.ADDED).size());
    }

    @Test
    void replacesPreviousGeneration() throws IOException {
        Path target = tempDir.resolve("articy");
        OutputReconciler reconciler = new OutputReconciler(target, "articy_");
        reconciler.reconcile(tree("label label_c1:\n    jump end\n", true));

        OutputReconciler.Report report = reconciler.reconcile(tree("label label_c1:\n    return\n", false));

        assertFalse(report.isCreatedTargetDir());
        assertEquals(3, report.getDeletedEntries());
        assertFalse(Files.exists(target.resolve("chapter_1/scene")));
        assertEquals("label label_c1:\n    return\n", Files.readString(target.resolve("chapter_1/articy_chapter_1.rpy")));
        GenerationDiff diff = report.getDiff();
        assertEquals(List.of("chapter_1/articy_chapter_1.rpy"),
            diff.getChanges(GenerationDiff.Status.CHANGED).stream().map(GenerationDiff.FileChange::path).toList());
        assertEquals(List.of("chapter_1/scene/articy_scene.rpy"),
            diff.getChanges(GenerationDiff.Status.REMOVED).stream().map(GenerationDiff.FileChange::path).toList());
    }

    @Test
    void byteCompiledScriptsAreDeletedButNotCompared() throws IOException {
        Path target = tempDir.resolve("articy");
        OutputReconciler reconciler = new OutputReconciler(target, "articy_");
        reconciler.reconcile(tree("label label_c1:\n    jump end\n", false));
        Files.write(target.resolve("articy_start.rpyc"), new byte[] {(byte) 0x80, 0x0a, (byte) 0xff, 0x00, 0x41});
        Files.write(target.resolve("chapter_1/articy_chapter_1.rpyc"), new byte[] {0x41, 0x0a});

        OutputReconciler.Report report = reconciler.reconcile(tree("label label_c1:\n    jump end\n", false));

        assertFalse(report.getDiff().hasChanges());
        assertTrue(report.getDiff().summary().isEmpty());
        assertEquals("", report.getDiff().unifiedDiff());
        assertFalse(Files.exists(target.resolve("articy_start.rpyc")));
    }

    @Test
    void snapshotSkipsFilesThatAreNotUtf8() throws IOException {
        Path target = tempDir.resolve("articy");
        Files.createDirectories(target);
        Files.writeString(target.resolve("articy_start.rpy"), "label start:\n");
        Files.write(target.resolve("articy_broken.rpy"), new byte[] {(byte) 0xc3, 0x28});

        Map<String, String> snapshot = new OutputReconciler(target, "articy_").snapshot();

        assertEquals(Map.of("articy_start.rpy", "label start:\n"), snapshot);
    }

    @Test
    void abortsWithoutTouchingUnexpectedContent() throws IOException {
        Path target = tempDir.resolve("articy");
        Files.createDirectories(target.resolve("chapter_1"));
        Files.writeString(target.resolve("articy_start.rpy"), "old start");
        Files.writeString(target.resolve("chapter_1/articy_chapter_1.rpy"), "old chapter");
        Files.writeString(target.resolve("script.rpy"), "hand written");
        OutputReconciler reconciler = new OutputReconciler(target, "articy_");
        Map<String, String> before = reconciler.snapshot();

        UnexpectedContentException e = assertThrows(UnexpectedContentException.class,
            () -> reconciler.reconcile(tree("new chapter", false)));

        assertEquals("script.rpy", e.getEntryName());
        assertEquals(target, e.getTargetDir());
        assertEquals(before, reconciler.snapshot());
    }

    @Test
    void abortsOnUnexpectedDirectory() throws IOException {
        Path target = tempDir.resolve("articy");
        Files.createDirectories(target.resolve("chapter_0"));
        OutputReconciler reconciler = new OutputReconciler(target, "articy_");

        UnexpectedContentException e = assertThrows(UnexpectedContentException.class,
            () -> reconciler.reconcile(tree("new chapter", false)));

        assertEquals("chapter_0", e.getEntryName());
        assertTrue(Files.isDirectory(target.resolve("chapter_0")));
    }

    @Test
    void targetThatIsAFileFails() throws IOException {
        Path target = tempDir.resolve("articy");
        Files.writeString(target, "not a directory");

        assertThrows(IOException.class, () -> new OutputReconciler(target, "articy_").reconcile(tree("x", false)));
    }
}
