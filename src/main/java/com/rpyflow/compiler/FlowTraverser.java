package com.rpyflow.compiler;

import com.rpyflow.AppLogger;
import com.rpyflow.LogAggregator;
import com.rpyflow.models.CompiledBlock;
import com.rpyflow.models.FileUnit;
import com.rpyflow.models.FlowGraph;
import com.rpyflow.models.FlowNode;
import com.rpyflow.models.ScriptLine;
import com.rpyflow.settings.CompilerSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Walks the container hierarchy depth-first, opening one {@link FileUnit} per container and
 * compiling every node exactly once. Jumps stay node ids until {@link #render()}, when every
 * label is known.
 */
public class FlowTraverser {
    static final String BASE_HEADER = "Entry point and end of the generated flow";

    private final CompilationContext context;
    private final NodeCompiler nodeCompiler;
    private final List<FileUnit> units = new ArrayList<>();
    private final List<String> topLevelDirectories = new ArrayList<>();
    private final Map<String, String> pathOwners = new HashMap<>();
    private final Set<String> visited = new HashSet<>();
    private FileUnit baseUnit;
    private boolean traversed;

    public FlowTraverser(CompilationContext context) {
        this(context, new NodeCompiler(context, new BranchResolver(context)));
    }

    FlowTraverser(CompilationContext context, NodeCompiler nodeCompiler) {
        this.context = context;
        this.nodeCompiler = nodeCompiler;
    }

    /**
     * Compiles the whole flow into file units.
     *
     * @throws CompilationException when the flow is empty, the start node is unknown, or two
     *                              nodes or containers collide on a label or output path
     */
    public void traverse() {
        if (traversed) {
            throw new IllegalStateException("Flow already traversed");
        }
        traversed = true;

        CompilerSettings settings = context.getSettings();
        FlowGraph graph = context.getGraph();
        context.getLabels().reserve(settings.getStartLabel());
        context.getLabels().reserve(settings.getEndLabel());

        baseUnit = new FileUnit("", settings.prefixed(settings.getBaseFileName()), BASE_HEADER);
        units.add(baseUnit);
        baseUnit.append(new CompiledBlock(settings.getStartLabel(), null,
            List.of(ScriptLine.jump(1, startNodeId(graph, settings)))));

        for (String rootId : graph.getRootIds()) {
            FlowNode root = graph.getNode(rootId);
            if (root == null) {
                log("Skipping unknown top-level node " + rootId);
                continue;
            }
            if (root.getKind().isContainer()) {
                String directory = visit(root, "");
                if (directory != null) {
                    topLevelDirectories.add(directory);
                }
            } else {
                compileInto(root, baseUnit);
            }
        }

        baseUnit.append(new CompiledBlock(settings.getEndLabel(), null, List.of(ScriptLine.of(1, "return"))));
        baseUnit.close();
    }

    private String startNodeId(FlowGraph graph, CompilerSettings settings) {
        String configured = settings.getStartNode();
        if (configured != null && !configured.isBlank()) {
            String id = configured.strip();
            if (graph.getNode(id) == null) {
                throw new CompilationException(id, "Configured start node " + id + " does not exist");
            }
            return id;
        }
        for (String rootId : graph.getRootIds()) {
            if (graph.getNode(rootId) != null) {
                return rootId;
            }
        }
        throw new CompilationException(null, "The flow has no top-level node to start from");
    }

    /**
     * @return the directory of the container, or null if it was already visited
     */
    private String visit(FlowNode container, String parentDirectory) {
        if (!visited.add(container.getId())) {
            return null;
        }
        String name = directoryName(container);
        String directory = parentDirectory.isEmpty() ? name : parentDirectory + "/" + name;
        String owner = pathOwners.putIfAbsent(directory, container.getId());
        if (owner != null) {
            throw new CompilationException(container.getId(),
                "Containers " + owner + " and " + container.getId() + " both map to directory \"" + directory + "\"");
        }
        context.registerDirectory(container.getId(), directory);

        FileUnit unit = new FileUnit(directory, context.getSettings().prefixed(name + ".rpy"), container.getDisplayName());
        units.add(unit);
        append(unit, nodeCompiler.compile(container, unit));

        for (FlowNode child : context.getGraph().childrenOf(container.getId())) {
            if (child.getKind().isContainer()) {
                visit(child, directory);
            } else {
                compileInto(child, unit);
            }
        }
        unit.close();
        return directory;
    }

    private void compileInto(FlowNode node, FileUnit unit) {
        if (visited.add(node.getId())) {
            append(unit, nodeCompiler.compile(node, unit));
        }
    }

    private void append(FileUnit unit, CompiledBlock block) {
        if (block != null) {
            unit.append(block);
        }
    }

    /**
     * Lower-cased display name with spaces turned into underscores; the id when there is no name.
     */
    static String directoryName(FlowNode container) {
        String name = container.hasDisplayName() ? container.getDisplayName().strip() : container.getId();
        name = name.toLowerCase(Locale.ROOT).replace(' ', '_').replace('/', '_').replace('\\', '_');
        if (name.isEmpty() || ".".equals(name) || "..".equals(name)) {
            return container.getId().toLowerCase(Locale.ROOT);
        }
        return name;
    }

    /**
     * Renders every unit, resolving deferred jumps. Jumps to nodes without a label fall back to
     * the end label and are reported.
     *
     * @return file contents keyed by path relative to the target directory, base file first
     */
    public Map<String, String> render() {
        if (!traversed) {
            throw new IllegalStateException("Flow not traversed yet");
        }
        String end = context.getSettings().getEndLabel();
        LogAggregator log = context.getLog();
        Map<String, String> files = new LinkedHashMap<>();
        for (FileUnit unit : units) {
            String content = unit.render((from, targetId) -> context.getLabels().lookup(targetId).orElseGet(() -> {
                log.report(unit.getPath(), from.getLabel(),
                    "jumps to unknown node \"" + targetId + "\", will jump to \"" + end + "\"");
                return end;
            }));
            files.put(unit.getPath(), content);
        }
        return files;
    }

    /** Directories created for top-level containers, in traversal order. */
    public List<String> getTopLevelDirectories() {
        return Collections.unmodifiableList(topLevelDirectories);
    }

    private void log(String message) {
        if (AppLogger.get() != null) {
            AppLogger.get().warn(message);
        }
    }
}
