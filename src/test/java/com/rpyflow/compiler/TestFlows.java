package com.rpyflow.compiler;

import com.rpyflow.LogAggregator;
import com.rpyflow.directives.DirectiveParser;
import com.rpyflow.directives.DirectiveSchema;
import com.rpyflow.models.Connection;
import com.rpyflow.models.FlowGraph;
import com.rpyflow.models.FlowNode;
import com.rpyflow.models.NodeKind;
import com.rpyflow.models.Pin;
import com.rpyflow.render.AssetIndex;
import com.rpyflow.render.TextRenderer;
import com.rpyflow.settings.CompilerSettings;

import java.nio.file.Path;
import java.util.Map;

/**
 * Small flows for compiler tests. Every node gets an input pin {@code <id>-in} and an output pin
 * {@code <id>-out}; conditions get {@code <id>-true} and {@code <id>-false} instead.
 */
final class TestFlows {

    private TestFlows() {}

    static CompilerSettings settings() {
        return new CompilerSettings.Builder()
            .pathArticyJson(Path.of("export.json"))
            .pathTargetDir(Path.of("game", "articy"))
            .build();
    }

    static CompilationContext context(CompilerSettings settings, FlowGraph graph, Map<String, String> tokens) {
        return new CompilationContext(settings, graph,
            new DirectiveParser(DirectiveSchema.standard(settings)),
            new TextRenderer(AssetIndex.disabled(), settings.getBeginningsLogLines()),
            new LogAggregator(), tokens);
    }

    static FlowNode container(String id, String name, String parentId) {
        FlowNode node = node(id, NodeKind.CONTAINER, "FlowFragment", parentId);
        node.setDisplayName(name);
        return node;
    }

    static FlowNode dialogue(String id, String parentId, String text) {
        FlowNode node = node(id, NodeKind.DIALOGUE, "DialogueFragment", parentId);
        node.setText(text);
        return node;
    }

    static FlowNode rawCode(String id, String parentId, String text) {
        FlowNode node = node(id, NodeKind.RAW_CODE, "RenPyBox", parentId);
        node.setText(text);
        return node;
    }

    static FlowNode hub(String id, String parentId) {
        return node(id, NodeKind.HUB, "Hub", parentId);
    }

    static FlowNode condition(String id, String parentId, String expression) {
        FlowNode node = new FlowNode(id, NodeKind.CONDITION, "Condition", parentId);
        node.getInputPins().add(new Pin(id + "-in", id, null));
        node.getOutputPins().add(new Pin(id + "-true", id, null));
        node.getOutputPins().add(new Pin(id + "-false", id, null));
        node.setExpression(expression);
        return node;
    }

    static FlowNode node(String id, NodeKind kind, String type, String parentId) {
        FlowNode node = new FlowNode(id, kind, type, parentId);
        node.getInputPins().add(new Pin(id + "-in", id, null));
        node.getOutputPins().add(new Pin(id + "-out", id, null));
        return node;
    }

    /** Connects the first output pin of {@code from} to {@code to}. */
    static void connect(FlowNode from, FlowNode to) {
        connect(from, to, null);
    }

    static void connect(FlowNode from, FlowNode to, String label) {
        from.getOutputPins().get(0).addConnection(new Connection(label, to.getId() + "-in", to.getId()));
    }

    /** Connects a container's input pin to its first child. */
    static void enter(FlowNode container, FlowNode child) {
        container.getInputPins().get(0).addConnection(new Connection(null, child.getId() + "-in", child.getId()));
    }

    /** Connects a child's output pin to the output pin of its container. */
    static void leave(FlowNode child, FlowNode container) {
        child.getOutputPins().get(0).addConnection(new Connection(null, container.getId() + "-out", container.getId()));
    }

    static FlowGraph graph(FlowNode... nodes) {
        FlowGraph graph = new FlowGraph();
        for (FlowNode node : nodes) {
            graph.addNode(node);
            if (node.getParentId() == null) {
                graph.addRoot(node.getId());
            }
        }
        return graph;
    }
}
