package com.rpyflow.models;

public class Connection {
    private String label;
    private String targetPinId;
    private String targetNodeId;

    public Connection() {}

    public Connection(String label, String targetPinId, String targetNodeId) {
        this.label = label;
        this.targetPinId = targetPinId;
        this.targetNodeId = targetNodeId;
    }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public String getTargetPinId() { return targetPinId; }
    public void setTargetPinId(String targetPinId) { this.targetPinId = targetPinId; }

    public String getTargetNodeId() { return targetNodeId; }
    public void setTargetNodeId(String targetNodeId) { this.targetNodeId = targetNodeId; }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }
}
