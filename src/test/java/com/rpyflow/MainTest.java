package com.rpyflow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private Path settingsFile;
    private Path target;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/export/sample_export.json")) {
            assertNotNull(in);
            Files.copy(in, tempDir.resolve("export.json"), StandardCopyOption.REPLACE_EXISTING);
        }
        Path game = tempDir.resolve("game");
        Files.createDirectories(game.resolve("images/chapter_1"));
        Files.writeString(game.resolve("images/chapter_1/eileen.png"), "png");
        target = game.resolve("articy");

        settingsFile = tempDir.resolve("config.ini");
        Files.writeString(settingsFile,
            "[Paths]\n"
                + "path_articy_json = export.json\n"
                + "path_target_dir = game/articy\n");
    }

    private int run() {
        return Main.run(new String[] {settingsFile.toString(), "--quiet"});
    }

    @Test
    void compilesSampleExport() throws IOException {
        assertEquals(0, run());

        String chapter = Files.readString(target.resolve("chapter_1/articy_chapter_1.rpy"));
        assertTrue(chapter.startsWith("# Chapter 1\n\nlabel label_0x10:\n"));
        assertTrue(chapter.contains("    # The first morning\n"));
        assertTrue(chapter.contains("    character.eileen \"Hello!\"\n    jump label_0x12\n"));
        assertTrue(chapter.contains(
            "    menu:\n"
                + "        extend \"\"\n"
                + "        \"Go back to sleep\" if GameState.coins > 0:\n"
                + "            jump label_0x14\n"
                + "        \"Get up\":\n"
                + "            jump label_0x13\n"));
        assertTrue(chapter.contains("    show 'images/chapter_1/eileen.png'\n"));
        assertTrue(chapter.contains("    $ GameState.awake = True\n    $ GameState.coins = GameState.coins + 1\n"));
        assertTrue(chapter.contains("    if GameState.awake and GameState.coins > 2:\n        jump label_0x18\n    else:\n        jump end\n"));
        assertTrue(chapter.contains("label label_0x18:\n    # Jump\n    # Again\n    jump label_0x11\n"));

        assertTrue(Files.readString(target.resolve("articy_start.rpy")).contains("label start:\n    jump label_0x10\n"));
        String characters = Files.readString(target.resolve("articy_characters.rpy"));
        assertTrue(characters.contains("define character.eileen = Character(\"Eileen\", color=\"#c8ffc8\")\n"));
        assertTrue(characters.contains("define character.eileen_1 = Character(\"Eileen Smith\")\n"));
        assertTrue(Files.readString(target.resolve("articy_variables.rpy"))
            .contains("init python in gameState:\n    # Player woke up\n    awake = False\n    coins = 3\n"));

        String log = Files.readString(target.resolve("articy_log.txt"));
        assertTrue(log.startsWith("chapter_1/articy_chapter_1.rpy\n"));
        assertTrue(log.contains("    label_0x15 contains the following line: # TODO add music\n"));
        assertTrue(log.contains("    Type \"Flag\" of model 0x1A is not supported\n"));
        assertFalse(log.contains("non-existent"));
    }

    @Test
    void secondRunProducesIdenticalOutput() throws IOException {
        assertEquals(0, run());
        String first = Files.readString(target.resolve("chapter_1/articy_chapter_1.rpy"));

        assertEquals(0, run());

        assertEquals(first, Files.readString(target.resolve("chapter_1/articy_chapter_1.rpy")));
    }

    @Test
    void refusesToClearForeignContent() throws IOException {
        Files.createDirectories(target);
        Files.writeString(target.resolve("script.rpy"), "label start:\n    return\n");

        assertEquals(1, run());

        assertEquals("label start:\n    return\n", Files.readString(target.resolve("script.rpy")));
        assertFalse(Files.exists(target.resolve("articy_start.rpy")));
    }

    @Test
    void missingSettingsFileFails() {
        assertEquals(1, Main.run(new String[] {tempDir.resolve("nope.ini").toString(), "--quiet"}));
    }

    @Test
    void duplicateModelIdFailsWithoutWriting() throws IOException {
        Files.writeString(tempDir.resolve("export.json"), "{\"Packages\":["
            + "{\"Models\":[{\"Type\":\"FlowFragment\",\"Properties\":{\"Id\":\"A\"}}]},"
            + "{\"Models\":[{\"Type\":\"FlowFragment\",\"Properties\":{\"Id\":\"A\"}}]}]}");

        assertEquals(1, run());
        assertFalse(Files.exists(target));
    }
}
