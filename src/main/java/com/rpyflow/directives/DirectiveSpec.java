package com.rpyflow.directives;

import java.util.Locale;

public class DirectiveSpec {
    public enum Type {
        STRING,
        INT,
        BOOLEAN
    }

    private final String name;
    private final Type type;
    private final Object defaultValue;

    public DirectiveSpec(String name, Type type, Object defaultValue) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    /**
     * Converts a raw directive value to this directive's type.
     *
     * @return the typed value, or null when the value cannot be coerced
     */
    public Object coerce(String raw) {
        if (raw == null) {
            return type == Type.BOOLEAN ? Boolean.TRUE : null;
        }
        String value = raw.trim();
        switch (type) {
            case STRING:
                return value;
            case INT:
                try {
                    return Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    return null;
                }
            case BOOLEAN:
                String lower = value.toLowerCase(Locale.ROOT);
                if ("true".equals(lower)) return Boolean.TRUE;
                if ("false".equals(lower)) return Boolean.FALSE;
                return null;
            default:
                return null;
        }
    }
}
