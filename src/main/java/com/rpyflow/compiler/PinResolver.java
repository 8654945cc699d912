package com.rpyflow.compiler;

import com.rpyflow.models.Connection;
import com.rpyflow.models.FlowGraph;
import com.rpyflow.models.FlowNode;
import com.rpyflow.models.Pin;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Follows a connection to the node it finally enters.
 * <p>
 * When the last node inside a container connects to the container's output pin, the flow continues
 * wherever that output pin is connected, possibly through several nested containers. The walk stops
 * at the first input pin; an output pin seen twice or left unconnected ends it without a target.
 */
public class PinResolver {

    private final FlowGraph graph;

    public PinResolver(FlowGraph graph) {
        this.graph = graph;
    }

    public Optional<Target> resolve(Connection connection) {
        Set<String> seen = new HashSet<>();
        Connection current = connection;
        while (current != null) {
            Pin input = graph.getInputPin(current.getTargetPinId());
            if (input != null) {
                FlowNode owner = graph.getNode(input.getOwnerId());
                return owner != null ? Optional.of(new Target(owner, input)) : Optional.empty();
            }
            Pin output = graph.getOutputPin(current.getTargetPinId());
            if (output == null) {
                FlowNode node = graph.getNode(current.getTargetNodeId());
                return node != null ? Optional.of(new Target(node, node.firstInputPin())) : Optional.empty();
            }
            if (!seen.add(output.getId()) || !output.hasConnections()) {
                return Optional.empty();
            }
            current = output.getConnections().get(0);
        }
        return Optional.empty();
    }

    /**
     * The node a connection leads to and the input pin it enters through (may be null).
     */
    public record Target(FlowNode node, Pin inputPin) {}
}
