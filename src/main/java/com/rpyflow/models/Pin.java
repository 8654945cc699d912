package com.rpyflow.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Input or output pin of a node. Input pins carry conditions, output pins carry instructions.
 */
public class Pin {
    private String id;
    private String ownerId;
    private String text;
    private List<Connection> connections = new ArrayList<>();

    public Pin() {}

    public Pin(String id, String ownerId, String text) {
        this.id = id;
        this.ownerId = ownerId;
        this.text = text;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public List<Connection> getConnections() { return connections; }
    public void setConnections(List<Connection> connections) {
        this.connections = connections != null ? connections : new ArrayList<>();
    }

    public void addConnection(Connection connection) {
        connections.add(connection);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasConnections() {
        return !connections.isEmpty();
    }
}
