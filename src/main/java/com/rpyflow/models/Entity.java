package com.rpyflow.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A speaking entity. Parameters become keyword arguments of its Ren'Py {@code Character(...)} definition.
 */
public class Entity {
    private String id;
    private String displayName;
    private String renpyName;
    private Map<String, Object> parameters = new LinkedHashMap<>();

    public Entity() {}

    public Entity(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public String getRenpyName() { return renpyName; }
    public void setRenpyName(String renpyName) { this.renpyName = renpyName; }

    public Map<String, Object> getParameters() { return parameters; }
    public void setParameters(Map<String, Object> parameters) {
        this.parameters = parameters != null ? parameters : new LinkedHashMap<>();
    }

    public void putParameter(String name, Object value) {
        parameters.put(name, value);
    }

    /**
     * Name shown by Ren'Py: the explicit Ren'Py name when set, else the display name.
     */
    public String getShownName() {
        if (renpyName != null && !renpyName.isBlank()) {
            return renpyName;
        }
        return displayName != null ? displayName : "";
    }
}
