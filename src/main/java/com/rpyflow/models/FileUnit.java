package com.rpyflow.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A script file under construction. Blocks are appended while the subtree of its container is
 * traversed; once closed the unit rejects further blocks.
 */
public class FileUnit {
    public static final String INDENT = "    ";

    private final String directory;
    private final String fileName;
    private final String header;
    private final List<CompiledBlock> blocks = new ArrayList<>();
    private boolean closed;

    public FileUnit(String directory, String fileName, String header) {
        this.directory = directory != null ? directory : "";
        this.fileName = fileName;
        this.header = header;
    }

    public String getDirectory() {
        return directory;
    }

    public String getFileName() {
        return fileName;
    }

    /** Path relative to the target directory, always with forward slashes. */
    public String getPath() {
        return directory.isEmpty() ? fileName : directory + "/" + fileName;
    }

    public List<CompiledBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public boolean isClosed() {
        return closed;
    }

    public void append(CompiledBlock block) {
        if (closed) {
            throw new IllegalStateException("File unit already closed: " + getPath());
        }
        blocks.add(block);
    }

    public void close() {
        closed = true;
    }

    public String render(JumpResolver resolver) {
        StringBuilder sb = new StringBuilder();
        if (header != null && !header.isEmpty()) {
            sb.append("# ").append(header).append("\n\n");
        }
        for (CompiledBlock block : blocks) {
            sb.append("label ").append(block.getLabel()).append(":\n");
            for (ScriptLine line : block.getLines()) {
                sb.append(INDENT.repeat(line.depth()));
                if (line.isDeferredJump()) {
                    sb.append("jump ").append(resolver.resolve(block, line.jumpTargetId()));
                } else {
                    sb.append(line.text());
                }
                sb.append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Turns a deferred jump target into the label to jump to.
     */
    @FunctionalInterface
    public interface JumpResolver {
        String resolve(CompiledBlock from, String targetNodeId);
    }
}
