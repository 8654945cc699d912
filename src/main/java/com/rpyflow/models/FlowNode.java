package com.rpyflow.models;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of the exported flow. Containers own their children through {@link #getParentId()};
 * connections between nodes are kept on the pins and refer to other nodes by id only.
 */
public class FlowNode {
    private String id;
    private NodeKind kind;
    private String type;
    private String parentId;
    private String displayName;
    private String speakerId;
    private String text;
    private String menuText;
    private String directives;
    private String expression;
    private String jumpTargetId;
    private List<Pin> inputPins = new ArrayList<>();
    private List<Pin> outputPins = new ArrayList<>();

    public FlowNode() {}

    public FlowNode(String id, NodeKind kind, String type, String parentId) {
        this.id = id;
        this.kind = kind;
        this.type = type;
        this.parentId = parentId;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public NodeKind getKind() { return kind; }
    public void setKind(NodeKind kind) { this.kind = kind; }

    /** Technical type name as exported, e.g. {@code DialogueFragment} or a template name. */
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getParentId() { return parentId; }
    public void setParentId(String parentId) { this.parentId = parentId; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public String getSpeakerId() { return speakerId; }
    public void setSpeakerId(String speakerId) { this.speakerId = speakerId; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getMenuText() { return menuText; }
    public void setMenuText(String menuText) { this.menuText = menuText; }

    /** Raw directive string, exported by Articy as stage directions. */
    public String getDirectives() { return directives; }
    public void setDirectives(String directives) { this.directives = directives; }

    public String getExpression() { return expression; }
    public void setExpression(String expression) { this.expression = expression; }

    public String getJumpTargetId() { return jumpTargetId; }
    public void setJumpTargetId(String jumpTargetId) { this.jumpTargetId = jumpTargetId; }

    public List<Pin> getInputPins() { return inputPins; }
    public void setInputPins(List<Pin> inputPins) {
        this.inputPins = inputPins != null ? inputPins : new ArrayList<>();
    }

    public List<Pin> getOutputPins() { return outputPins; }
    public void setOutputPins(List<Pin> outputPins) {
        this.outputPins = outputPins != null ? outputPins : new ArrayList<>();
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasMenuText() {
        return menuText != null && !menuText.isBlank();
    }

    public boolean hasDisplayName() {
        return displayName != null && !displayName.isBlank();
    }

    public Pin firstInputPin() {
        return inputPins.isEmpty() ? null : inputPins.get(0);
    }

    @Override
    public String toString() {
        return type + " " + id;
    }
}
