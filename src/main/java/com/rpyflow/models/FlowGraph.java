package com.rpyflow.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parsed flow: nodes in declared order, the ids of the top-level hierarchy nodes,
 * entities and global variables. Pins are indexed so connections can be followed by pin id.
 */
public class FlowGraph {
    private final Map<String, FlowNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<FlowNode>> children = new HashMap<>();
    private final Map<String, Pin> inputPins = new HashMap<>();
    private final Map<String, Pin> outputPins = new HashMap<>();
    private final List<String> rootIds = new ArrayList<>();
    private final List<Entity> entities = new ArrayList<>();
    private final List<Variable> variables = new ArrayList<>();

    public FlowGraph addNode(FlowNode node) {
        if (node == null || node.getId() == null) {
            return this;
        }
        if (nodes.containsKey(node.getId())) {
            throw new IllegalArgumentException("Duplicate node id: " + node.getId());
        }
        nodes.put(node.getId(), node);
        if (node.getParentId() != null) {
            children.computeIfAbsent(node.getParentId(), key -> new ArrayList<>()).add(node);
        }
        for (Pin pin : node.getInputPins()) {
            adopt(node, pin);
            inputPins.put(pin.getId(), pin);
        }
        for (Pin pin : node.getOutputPins()) {
            adopt(node, pin);
            outputPins.put(pin.getId(), pin);
        }
        return this;
    }

    private void adopt(FlowNode node, Pin pin) {
        if (pin.getOwnerId() == null) {
            pin.setOwnerId(node.getId());
        }
    }

    public FlowGraph addRoot(String nodeId) {
        rootIds.add(nodeId);
        return this;
    }

    public FlowGraph addEntity(Entity entity) {
        entities.add(entity);
        return this;
    }

    public FlowGraph addVariable(Variable variable) {
        variables.add(variable);
        return this;
    }

    public FlowNode getNode(String id) {
        return id != null ? nodes.get(id) : null;
    }

    /**
     * Direct children of a container in declared order.
     */
    public List<FlowNode> childrenOf(String parentId) {
        List<FlowNode> list = children.get(parentId);
        return list != null ? Collections.unmodifiableList(list) : List.of();
    }

    public List<String> getRootIds() {
        return Collections.unmodifiableList(rootIds);
    }

    public List<Entity> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public Pin getInputPin(String pinId) {
        return pinId != null ? inputPins.get(pinId) : null;
    }

    public Pin getOutputPin(String pinId) {
        return pinId != null ? outputPins.get(pinId) : null;
    }

    public int size() {
        return nodes.size();
    }
}
