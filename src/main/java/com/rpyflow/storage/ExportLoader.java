package com.rpyflow.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rpyflow.AppLogger;
import com.rpyflow.models.Connection;
import com.rpyflow.models.Entity;
import com.rpyflow.models.FlowGraph;
import com.rpyflow.models.FlowNode;
import com.rpyflow.models.NodeKind;
import com.rpyflow.models.Pin;
import com.rpyflow.models.Variable;
import com.rpyflow.settings.CompilerSettings;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an Articy JSON export into a {@link FlowGraph}.
 *
 * <p>Nodes are taken from the {@code Flow} branch of the export hierarchy, which gives both the
 * parent of every node and the order of siblings. Template types are classified through the
 * {@code ObjectDefinitions} of the export unless they are configured as raw-code or entry-point
 * templates.</p>
 */
public class ExportLoader {
    static final String NO_SPEAKER = "0x0000000000000000";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final Map<String, NodeKind> BASE_KINDS = Map.of(
        "FlowFragment", NodeKind.CONTAINER,
        "Dialogue", NodeKind.CONTAINER,
        "DialogueFragment", NodeKind.DIALOGUE,
        "Hub", NodeKind.HUB,
        "Jump", NodeKind.JUMP,
        "Condition", NodeKind.CONDITION,
        "Instruction", NodeKind.INSTRUCTION,
        "Comment", NodeKind.COMMENT
    );
    private static final String ENTITY = "Entity";

    private final CompilerSettings settings;

    public ExportLoader(CompilerSettings settings) {
        this.settings = settings;
    }

    public FlowGraph load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Articy export not found: " + path);
        }
        JsonNode root = mapper.readTree(path.toFile());
        FlowGraph graph = read(root);
        log("Loaded " + graph.size() + " flow node(s), " + graph.getEntities().size() + " entity(ies) and "
            + graph.getVariables().size() + " variable(s) from " + path);
        return graph;
    }

    public FlowGraph parse(String json) throws IOException {
        return read(mapper.readTree(json));
    }

    /**
     * @throws IOException if the export has no models
     */
    FlowGraph read(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Articy export must be a JSON object");
        }
        Map<String, String> baseTypes = readObjectDefinitions(root.path("ObjectDefinitions"));
        Map<String, JsonNode> models = new LinkedHashMap<>();
        for (JsonNode pkg : root.path("Packages")) {
            for (JsonNode model : pkg.path("Models")) {
                String id = text(model.path("Properties"), "Id");
                if (id != null && models.putIfAbsent(id, model) != null) {
                    throw new IOException("Articy export contains model " + id + " more than once");
                }
            }
        }
        if (models.isEmpty()) {
            throw new IOException("Articy export contains no models");
        }

        FlowGraph graph = new FlowGraph();
        JsonNode flow = findFlowHierarchy(root.path("Hierarchy"));
        if (flow != null) {
            for (JsonNode element : flow.path("Children")) {
                addFromHierarchy(graph, element, null, models, baseTypes);
            }
        } else {
            addInModelOrder(graph, models, baseTypes);
        }

        for (JsonNode model : models.values()) {
            if (ENTITY.equals(baseType(model.path("Type").asText(), baseTypes))) {
                graph.addEntity(toEntity(model));
            }
        }
        readVariables(graph, root.path("GlobalVariables"));
        return graph;
    }

    private Map<String, String> readObjectDefinitions(JsonNode definitions) {
        Map<String, String> baseTypes = new HashMap<>();
        for (JsonNode definition : definitions) {
            String type = text(definition, "Type");
            String base = text(definition, "Class");
            if (base == null) {
                base = text(definition, "InheritsFrom");
            }
            if (type != null && base != null) {
                baseTypes.put(type, base);
            }
        }
        return baseTypes;
    }

    private JsonNode findFlowHierarchy(JsonNode hierarchy) {
        if (hierarchy.isMissingNode()) {
            return null;
        }
        if ("Flow".equals(text(hierarchy, "Type"))) {
            return hierarchy;
        }
        for (JsonNode child : hierarchy.path("Children")) {
            if ("Flow".equals(text(child, "Type"))) {
                return child;
            }
        }
        return null;
    }

    private void addFromHierarchy(FlowGraph graph, JsonNode element, String parentId,
                                  Map<String, JsonNode> models, Map<String, String> baseTypes) throws IOException {
        String id = text(element, "Id");
        if (id != null && graph.getNode(id) != null) {
            throw new IOException("Hierarchy lists node " + id + " more than once");
        }
        JsonNode model = id != null ? models.get(id) : null;
        String childParent = parentId;
        if (model != null) {
            FlowNode node = toNode(model, parentId, baseTypes);
            if (node != null) {
                graph.addNode(node);
                if (parentId == null) {
                    graph.addRoot(node.getId());
                }
                childParent = node.getId();
            }
        } else if (id != null) {
            log("Hierarchy references unknown model " + id);
        }
        for (JsonNode child : element.path("Children")) {
            addFromHierarchy(graph, child, childParent, models, baseTypes);
        }
    }

    private void addInModelOrder(FlowGraph graph, Map<String, JsonNode> models, Map<String, String> baseTypes) {
        List<FlowNode> nodes = new ArrayList<>();
        for (JsonNode model : models.values()) {
            String parent = text(model.path("Properties"), "Parent");
            FlowNode node = toNode(model, parent, baseTypes);
            if (node != null) {
                nodes.add(node);
            }
        }
        Map<String, FlowNode> byId = new HashMap<>();
        nodes.forEach(node -> byId.put(node.getId(), node));
        for (FlowNode node : nodes) {
            if (!byId.containsKey(node.getParentId())) {
                node.setParentId(null);
                graph.addRoot(node.getId());
            }
            graph.addNode(node);
        }
    }

    /**
     * @return the flow node for {@code model}, or null when the model is not part of the flow
     */
    FlowNode toNode(JsonNode model, String parentId, Map<String, String> baseTypes) {
        String type = model.path("Type").asText("");
        JsonNode properties = model.path("Properties");
        NodeKind kind = classify(type, baseTypes, properties);
        if (kind == null) {
            return null;
        }

        FlowNode node = new FlowNode(text(properties, "Id"), kind, type, parentId);
        node.setDisplayName(text(properties, "DisplayName"));
        node.setText(text(properties, "Text"));
        node.setMenuText(text(properties, "MenuText"));
        node.setDirectives(text(properties, "StageDirections"));
        node.setExpression(text(properties, "Expression"));
        node.setJumpTargetId(text(properties, "Target"));
        String speaker = text(properties, "Speaker");
        if (speaker != null && !speaker.isBlank() && !NO_SPEAKER.equals(speaker)) {
            node.setSpeakerId(speaker);
        }
        node.setInputPins(readPins(properties.path("InputPins"), node.getId()));
        node.setOutputPins(readPins(properties.path("OutputPins"), node.getId()));
        return node;
    }

    NodeKind classify(String type, Map<String, String> baseTypes, JsonNode properties) {
        if (settings.getRenpyEntryPoint().contains(type)) {
            return NodeKind.ENTRY_POINT;
        }
        if (settings.getRenpyBox().contains(type)) {
            return NodeKind.RAW_CODE;
        }
        NodeKind kind = BASE_KINDS.get(baseType(type, baseTypes));
        if (kind != null) {
            return kind;
        }
        if (properties.has("InputPins") || properties.has("OutputPins")) {
            return NodeKind.UNSUPPORTED;
        }
        return null;
    }

    private String baseType(String type, Map<String, String> baseTypes) {
        if (BASE_KINDS.containsKey(type) || ENTITY.equals(type)) {
            return type;
        }
        String base = baseTypes.get(type);
        return base != null ? base : type;
    }

    private List<Pin> readPins(JsonNode pins, String ownerId) {
        List<Pin> result = new ArrayList<>();
        for (JsonNode pinNode : pins) {
            String owner = text(pinNode, "Owner");
            Pin pin = new Pin(text(pinNode, "Id"), owner != null ? owner : ownerId, text(pinNode, "Text"));
            for (JsonNode connection : pinNode.path("Connections")) {
                pin.addConnection(new Connection(text(connection, "Label"),
                    text(connection, "TargetPin"), text(connection, "Target")));
            }
            result.add(pin);
        }
        return result;
    }

    /**
     * Properties of the configured template features become {@code Character} parameters; the
     * configured name property, wherever it sits, overrides the display name.
     */
    Entity toEntity(JsonNode model) {
        JsonNode properties = model.path("Properties");
        Entity entity = new Entity(text(properties, "Id"), text(properties, "DisplayName"));
        JsonNode template = model.path("Template");
        Iterator<Map.Entry<String, JsonNode>> features = template.fields();
        while (features.hasNext()) {
            Map.Entry<String, JsonNode> feature = features.next();
            boolean parameters = settings.getFeaturesRenpyCharacterParams().contains(feature.getKey());
            Iterator<Map.Entry<String, JsonNode>> fields = feature.getValue().fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().equals(settings.getRenpyCharacterName())) {
                    String name = field.getValue().asText("");
                    if (!name.isBlank()) {
                        entity.setRenpyName(name.strip());
                    }
                } else if (parameters) {
                    Object value = toValue(field.getValue());
                    if (value != null) {
                        entity.putParameter(field.getKey(), value);
                    }
                }
            }
        }
        return entity;
    }

    private Object toValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            return value.textValue().isEmpty() ? null : value.textValue();
        }
        return value.toString();
    }

    private void readVariables(FlowGraph graph, JsonNode namespaces) {
        for (JsonNode namespace : namespaces) {
            String name = text(namespace, "Namespace");
            for (JsonNode variableNode : namespace.path("Variables")) {
                Variable variable = new Variable(name, text(variableNode, "Variable"),
                    text(variableNode, "Type"), text(variableNode, "Value"));
                variable.setDescription(text(variableNode, "Description"));
                graph.addVariable(variable);
            }
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private void log(String message) {
        if (AppLogger.get() != null) {
            AppLogger.get().info(message);
        }
    }
}
