package com.rpyflow.directives;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Resolved directives of one node: defaults overridden by the node's own entries, plus the
 * warnings raised while parsing them.
 */
public class DirectiveSet {
    private final Map<String, Object> values;
    private final List<String> warnings;

    public DirectiveSet(Map<String, Object> values, List<String> warnings) {
        this.values = Collections.unmodifiableMap(values);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value != null ? value.toString() : null;
    }

    public Integer getInt(String name) {
        Object value = values.get(name);
        return value instanceof Integer ? (Integer) value : null;
    }

    public boolean getBoolean(String name) {
        return Boolean.TRUE.equals(values.get(name));
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
