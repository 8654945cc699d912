package com.rpyflow.compiler;

import com.rpyflow.LogAggregator;
import com.rpyflow.directives.DirectiveParser;
import com.rpyflow.directives.DirectiveSet;
import com.rpyflow.models.FlowGraph;
import com.rpyflow.models.FlowNode;
import com.rpyflow.render.TextRenderer;
import com.rpyflow.settings.CompilerSettings;

import java.util.HashMap;
import java.util.Map;

/**
 * State shared by the parts of one compilation run.
 */
public class CompilationContext {

    private final CompilerSettings settings;
    private final FlowGraph graph;
    private final DirectiveParser directiveParser;
    private final TextRenderer renderer;
    private final LogAggregator log;
    private final Map<String, String> characterTokens;
    private final LabelTable labels = new LabelTable();
    private final PinResolver pinResolver;
    private final Map<String, DirectiveSet> directives = new HashMap<>();
    private final Map<String, String> directories = new HashMap<>();

    public CompilationContext(CompilerSettings settings, FlowGraph graph, DirectiveParser directiveParser,
                              TextRenderer renderer, LogAggregator log, Map<String, String> characterTokens) {
        this.settings = settings;
        this.graph = graph;
        this.directiveParser = directiveParser;
        this.renderer = renderer;
        this.log = log;
        this.characterTokens = characterTokens != null ? characterTokens : Map.of();
        this.pinResolver = new PinResolver(graph);
    }

    public CompilerSettings getSettings() {
        return settings;
    }

    public FlowGraph getGraph() {
        return graph;
    }

    public TextRenderer getRenderer() {
        return renderer;
    }

    public LogAggregator getLog() {
        return log;
    }

    public LabelTable getLabels() {
        return labels;
    }

    public PinResolver getPinResolver() {
        return pinResolver;
    }

    /**
     * Directives of a node, parsed once. Warnings are reported when the node itself is compiled.
     */
    public DirectiveSet directivesOf(FlowNode node) {
        return directives.computeIfAbsent(node.getId(), id -> directiveParser.parse(node.getDirectives()));
    }

    public String characterToken(String entityId) {
        return entityId != null ? characterTokens.get(entityId) : null;
    }

    public void registerDirectory(String containerId, String directory) {
        directories.put(containerId, directory);
    }

    /** Output directory of a container, empty for the target root. */
    public String directoryOf(String containerId) {
        String directory = containerId != null ? directories.get(containerId) : null;
        return directory != null ? directory : "";
    }

    public String defaultLabel(FlowNode node) {
        return settings.getLabelPrefix() + node.getId();
    }
}
