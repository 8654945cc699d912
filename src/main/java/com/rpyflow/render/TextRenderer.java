package com.rpyflow.render;

import com.rpyflow.LogAggregator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns node text into Ren'Py script text.
 * <p>
 * Narration is escaped for string literals and may get markdown emphasis converted to text tags.
 * Raw code is emitted line by line; it is where image paths in braces are expanded, quoted asset
 * paths are checked against the game directory and marker lines are reported.
 */
public class TextRenderer {

    static final List<String> IMAGE_EXTENSIONS = List.of(".png", ".webp", ".gif", ".jpg", ".jpeg");
    static final List<String> AUDIO_EXTENSIONS = List.of(".ogg", ".mp3", ".wav", ".opus", ".flac");

    // Longest marker first so "**" is not read as two italics
    private static final String[][] EMPHASIS = {
        {"**", "b"},
        {"*", "i"},
        {"_", "u"},
    };
    private static final Pattern INTERPOLATION = Pattern.compile("\\[[^\\[\\]]*\\]");
    private static final Pattern BRACED = Pattern.compile("\\{([^{}]+)\\}");
    private static final Pattern QUOTED_ASSET = Pattern.compile(
        "([\"'])([^\"'\\r\\n]+?\\.(?:png|webp|gif|jpg|jpeg|ogg|mp3|wav|opus|flac))\\1",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n");

    private final AssetIndex assets;
    private final List<String> markerPrefixes;

    public TextRenderer(AssetIndex assets, List<String> markerPrefixes) {
        this.assets = assets != null ? assets : AssetIndex.disabled();
        this.markerPrefixes = new ArrayList<>();
        if (markerPrefixes != null) {
            for (String prefix : markerPrefixes) {
                if (prefix != null && !prefix.isBlank()) {
                    this.markerPrefixes.add(prefix.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // Narration
    // -------------------------------------------------------------------------

    /**
     * Renders narration or dialogue text into string-literal contents, one entry per paragraph.
     * Line breaks inside a paragraph become {@code \n}.
     */
    public List<String> narration(String text, boolean markdown) {
        List<String> paragraphs = new ArrayList<>();
        if (text == null) {
            return paragraphs;
        }
        String normalized = normalizeNewlines(text);
        for (String paragraph : PARAGRAPH_BREAK.split(normalized)) {
            if (paragraph.isBlank()) {
                continue;
            }
            List<String> lines = new ArrayList<>();
            for (String line : paragraph.strip().split("\n")) {
                lines.add(renderLine(line.strip(), markdown));
            }
            paragraphs.add(String.join("\\n", lines));
        }
        return paragraphs;
    }

    /**
     * Renders the text of a menu choice; always a single line. Emphasis is applied per source line.
     */
    public String choice(String text, boolean markdown) {
        if (text == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (String line : normalizeNewlines(text).split("\n")) {
            if (!line.isBlank()) {
                parts.add(renderLine(line.strip(), markdown));
            }
        }
        return String.join(" ", parts);
    }

    private String renderLine(String line, boolean markdown) {
        String escaped = escape(line);
        return markdown ? applyMarkdown(escaped) : escaped;
    }

    /**
     * Escapes the characters Ren'Py treats specially inside string literals.
     */
    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "\\\"").replace("'", "\\'").replace("%", "\\%");
    }

    /**
     * Converts {@code **bold**}, {@code *italics*} and {@code _underline_} to Ren'Py text tags.
     * Interpolations in square brackets are left untouched, and so are unpaired markers.
     */
    public static String applyMarkdown(String line) {
        if (line == null || line.isEmpty()) {
            return line;
        }
        StringBuilder sb = new StringBuilder();
        Matcher m = INTERPOLATION.matcher(line);
        int last = 0;
        while (m.find()) {
            sb.append(styleSegment(line.substring(last, m.start())));
            sb.append(m.group());
            last = m.end();
        }
        sb.append(styleSegment(line.substring(last)));
        return sb.toString();
    }

    /**
     * Scans left to right and converts the first complete span starting at each position. The
     * text inside a converted span is copied as is, so spans never nest or cross.
     */
    private static String styleSegment(String segment) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < segment.length()) {
            int next = -1;
            for (String[] emphasis : EMPHASIS) {
                next = styleSpan(segment, i, emphasis[0], emphasis[1], sb);
                if (next >= 0) {
                    break;
                }
            }
            if (next >= 0) {
                i = next;
            } else {
                sb.append(segment.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * @return the index after the closing marker, or -1 if no span of this kind starts at {@code start}
     */
    private static int styleSpan(String segment, int start, String marker, String tag, StringBuilder sb) {
        if (!segment.startsWith(marker, start)) {
            return -1;
        }
        int open = start + marker.length();
        int close = segment.indexOf(marker, open);
        if (close <= open) {
            return -1;
        }
        String content = segment.substring(open, close);
        if (content.indexOf(marker.charAt(0)) >= 0) {
            return -1;
        }
        sb.append('{').append(tag).append('}').append(content).append("{/").append(tag).append('}');
        return close + marker.length();
    }

    // -------------------------------------------------------------------------
    // Raw code
    // -------------------------------------------------------------------------

    /**
     * Renders the lines of a raw-code node. Blank lines are dropped.
     *
     * @param containerDir output directory of the node's container, used for braced image names
     * @param relativeImages whether braced image names are expanded
     * @param scope where diagnostics about asset references and marker lines go
     */
    public List<String> rawCode(String text, String containerDir, boolean relativeImages, LogAggregator.Scope scope) {
        List<String> lines = new ArrayList<>();
        if (text == null) {
            return lines;
        }
        for (String line : normalizeNewlines(text).split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            String rendered = line.stripTrailing();
            if (relativeImages) {
                rendered = inferBracketPaths(rendered, containerDir);
            }
            checkAssetReferences(rendered, scope);
            if (isMarkerLine(rendered)) {
                scope.report("contains the following line: " + rendered.strip());
            }
            lines.add(rendered);
        }
        return lines;
    }

    /**
     * Replaces {@code {name.png}} with the quoted path of the image relative to the game directory,
     * e.g. {@code 'images/chapter_1/name.png'}. Each leading {@code ../} climbs one directory.
     */
    public static String inferBracketPaths(String line, String containerDir) {
        Matcher m = BRACED.matcher(line);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String content = m.group(1).trim();
            if (hasExtension(content, IMAGE_EXTENSIONS)) {
                m.appendReplacement(sb, Matcher.quoteReplacement("'" + imagePath(content, containerDir) + "'"));
            } else {
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
            }
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static String imagePath(String name, String containerDir) {
        List<String> segments = new ArrayList<>();
        if (containerDir != null && !containerDir.isEmpty()) {
            for (String segment : containerDir.split("/")) {
                if (!segment.isEmpty()) {
                    segments.add(segment);
                }
            }
        }
        String remaining = name;
        while (remaining.startsWith("../")) {
            if (!segments.isEmpty()) {
                segments.remove(segments.size() - 1);
            }
            remaining = remaining.substring(3);
        }
        StringBuilder path = new StringBuilder("images");
        for (String segment : segments) {
            path.append('/').append(segment);
        }
        return path.append('/').append(remaining).toString();
    }

    void checkAssetReferences(String line, LogAggregator.Scope scope) {
        if (!assets.isEnabled()) {
            return;
        }
        Matcher m = QUOTED_ASSET.matcher(line);
        while (m.find()) {
            String reference = m.group(2);
            if (!assets.contains(reference)) {
                scope.report("references non-existent file \"" + reference + "\"");
            }
        }
    }

    boolean isMarkerLine(String line) {
        String lower = line.stripLeading().toLowerCase(Locale.ROOT);
        for (String prefix : markerPrefixes) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    static boolean hasExtension(String name, List<String> extensions) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static String normalizeNewlines(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
