package com.rpyflow.models;

public class Variable {
    private String namespace;
    private String name;
    private String type;
    private String value;
    private String description;

    public Variable() {}

    public Variable(String namespace, String name, String type, String value) {
        this.namespace = namespace;
        this.name = name;
        this.type = type;
        this.value = value;
    }

    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
