package com.rpyflow.render;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AssetIndexTest {

    @TempDir
    Path tempDir;

    @Test
    void indexesFilesUnderEnclosingGameDirectory() throws Exception {
        Path game = tempDir.resolve("my_game").resolve("game");
        Files.createDirectories(game.resolve("images/chapter_1"));
        Files.writeString(game.resolve("images/chapter_1/eileen.png"), "png");
        Path target = game.resolve("articy");

        AssetIndex index = AssetIndex.forTargetDir(target);

        assertTrue(index.isEnabled());
        assertEquals(game.toAbsolutePath().normalize(), index.getGameDir());
        assertTrue(index.contains("images/chapter_1/eileen.png"));
        assertTrue(index.contains("./images/chapter_1/eileen.png"));
        assertFalse(index.contains("images/eileen.png"));
    }

    @Test
    void disabledWithoutGameDirectory() throws Exception {
        AssetIndex index = AssetIndex.forTargetDir(tempDir.resolve("out"));

        assertFalse(index.isEnabled());
        assertTrue(index.contains("anything.png"));
    }
}
