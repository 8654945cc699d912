package com.rpyflow.render;

import com.rpyflow.LogAggregator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextRendererTest {

    private static final String FILE = "chapter_1/articy_chapter_1.rpy";

    private final LogAggregator log = new LogAggregator();
    private final LogAggregator.Scope scope = log.scope(FILE, "label_r1");

    private List<String> messages() {
        return log.getDiagnostics(FILE).stream().map(d -> d.getMessage()).toList();
    }

    @Test
    void escapesStringLiteralCharacters() {
        assertEquals("He said \\\"100\\%\\\", didn\\'t he?", TextRenderer.escape("He said \"100%\", didn't he?"));
    }

    @Test
    void narrationSplitsParagraphsAndJoinsLines() {
        TextRenderer renderer = new TextRenderer(AssetIndex.disabled(), List.of());

        List<String> paragraphs = renderer.narration("Line one\r\nLine two\r\n\r\nSecond", false);

        assertEquals(List.of("Line one\\nLine two", "Second"), paragraphs);
    }

    @Test
    void choiceTextIsOneLine() {
        TextRenderer renderer = new TextRenderer(AssetIndex.disabled(), List.of());

        assertEquals("Go *now*", renderer.choice("Go\n*now*", false));
        assertEquals("Go {i}now{/i}", renderer.choice("Go\n*now*", true));
    }

    @Test
    void markdownBecomesTextTags() {
        assertEquals("{b}bold{/b} and {i}it{/i} and {u}under{/u}",
            TextRenderer.applyMarkdown("**bold** and *it* and _under_"));
    }

    @Test
    void markdownSkipsInterpolationsAndUnpairedMarkers() {
        assertEquals("[player_first_name] is {i}here{/i}", TextRenderer.applyMarkdown("[player_first_name] is *here*"));
        assertEquals("2 * 3 = 6", TextRenderer.applyMarkdown("2 * 3 = 6"));
        assertEquals("snake_case", TextRenderer.applyMarkdown("snake_case"));
    }

    @Test
    void overlappingEmphasisKeepsTheFirstSpanAndLeavesTheRestLiteral() {
        assertEquals("{b}a _b{/b} c_", TextRenderer.applyMarkdown("**a _b** c_"));
        assertEquals("{u}x *y{/u} z*", TextRenderer.applyMarkdown("_x *y_ z*"));
    }

    @Test
    void choiceEmphasisDoesNotPairAcrossLines() {
        TextRenderer renderer = new TextRenderer(AssetIndex.disabled(), List.of());

        assertEquals("**a b**", renderer.choice("**a\nb**", true));
    }

    @Test
    void rawCodeDropsBlankLinesAndReportsMarkers() {
        TextRenderer renderer = new TextRenderer(AssetIndex.disabled(), List.of("# todo", "#todo"));

        List<String> lines = renderer.rawCode("scene bg room   \n\n# TODO: fix this\n#todo later", "", false, scope);

        assertEquals(List.of("scene bg room", "# TODO: fix this", "#todo later"), lines);
        assertEquals(List.of("contains the following line: # TODO: fix this",
            "contains the following line: #todo later"), messages());
    }

    @Test
    void inferBracketPathsUsesContainerDirectory() {
        assertEquals("show 'images/chapter_1/scene_2/eileen.png' at left",
            TextRenderer.inferBracketPaths("show {eileen.png} at left", "chapter_1/scene_2"));
        assertEquals("scene 'images/chapter_1/bg.JPG'",
            TextRenderer.inferBracketPaths("scene {../bg.JPG}", "chapter_1/scene_2"));
        assertEquals("'images/top.png'", TextRenderer.inferBracketPaths("{../../../top.png}", "chapter_1"));
        assertEquals("text \"{b}bold{/b}\" {w=0.5}", TextRenderer.inferBracketPaths("text \"{b}bold{/b}\" {w=0.5}", "c"));
    }

    @Test
    void bracketPathsAreOnlyInferredWhenEnabled() {
        TextRenderer renderer = new TextRenderer(AssetIndex.disabled(), List.of());

        assertEquals(List.of("show {eileen.png}"), renderer.rawCode("show {eileen.png}", "chapter_1", false, scope));
        assertEquals(List.of("show 'images/chapter_1/eileen.png'"),
            renderer.rawCode("show {eileen.png}", "chapter_1", true, scope));
    }

    @Test
    void reportsMissingAssets() {
        TextRenderer renderer = new TextRenderer(AssetIndex.of(List.of("images/bg.png")), List.of());

        renderer.rawCode("scene \"images/bg.png\"\nplay music 'audio/Theme.OGG'\n$ x = \"notes.txt\"", "", false, scope);

        assertEquals(List.of("references non-existent file \"audio/Theme.OGG\""), messages());
    }

    @Test
    void disabledAssetIndexAcceptsEverything() {
        TextRenderer renderer = new TextRenderer(AssetIndex.disabled(), List.of());

        renderer.rawCode("scene \"images/nowhere.png\"", "", false, scope);

        assertTrue(log.isEmpty());
    }
}
