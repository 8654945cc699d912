package com.rpyflow.compiler;

import com.rpyflow.LogAggregator;
import com.rpyflow.output.GeneratedTree;

/**
 * Output of a successful compilation: the generated tree, log report included, and the
 * diagnostics it was rendered from.
 */
public class CompilationResult {
    private final GeneratedTree tree;
    private final LogAggregator log;
    private final int compiledNodes;

    public CompilationResult(GeneratedTree tree, LogAggregator log, int compiledNodes) {
        this.tree = tree;
        this.log = log;
        this.compiledNodes = compiledNodes;
    }

    public GeneratedTree getTree() {
        return tree;
    }

    public LogAggregator getLog() {
        return log;
    }

    public int getCompiledNodes() {
        return compiledNodes;
    }
}
