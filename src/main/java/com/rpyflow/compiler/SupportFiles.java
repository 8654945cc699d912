package com.rpyflow.compiler;

import com.rpyflow.models.Entity;
import com.rpyflow.models.Variable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the variables and characters files written next to the generated flow.
 */
public final class SupportFiles {
    static final String VARIABLES_HEADER = "Global variables";
    static final String CHARACTERS_HEADER = "Character definitions";

    private SupportFiles() {
    }

    /**
     * Assigns each entity a Ren'Py character token: the prefix followed by the first word of its
     * display name, lower-cased, with {@code _1}, {@code _2}, ... appended on collision.
     */
    public static Map<String, String> assignCharacterTokens(Collection<Entity> entities, String prefix) {
        Map<String, String> tokens = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (Entity entity : entities) {
            String base = prefix + firstWord(entity.getDisplayName(), entity.getId());
            String token = base;
            int count = 1;
            while (!used.add(token)) {
                token = base + "_" + count++;
            }
            tokens.put(entity.getId(), token);
        }
        return tokens;
    }

    private static String firstWord(String displayName, String fallback) {
        String name = displayName != null ? displayName.strip() : "";
        if (name.isEmpty()) {
            return fallback.toLowerCase(Locale.ROOT);
        }
        return name.split("\\s+")[0].toLowerCase(Locale.ROOT);
    }

    public static String renderCharacters(Collection<Entity> entities, Map<String, String> tokens) {
        StringBuilder sb = new StringBuilder("# ").append(CHARACTERS_HEADER).append("\n\n");
        for (Entity entity : entities) {
            sb.append("define ").append(tokens.get(entity.getId()))
                .append(" = Character(").append(pythonString(entity.getShownName()));
            for (Map.Entry<String, Object> parameter : entity.getParameters().entrySet()) {
                sb.append(", ").append(parameter.getKey()).append('=').append(pythonValue(parameter.getValue()));
            }
            sb.append(")\n");
        }
        return sb.toString();
    }

    /**
     * One {@code init python in <store>:} block per namespace, in discovery order. The first
     * letter of the namespace is lower-cased.
     *
     * @throws CompilationException for a variable of unsupported type or with an unparsable value
     */
    public static String renderVariables(List<Variable> variables) {
        Map<String, List<Variable>> byNamespace = new LinkedHashMap<>();
        for (Variable variable : variables) {
            byNamespace.computeIfAbsent(storeName(variable.getNamespace()), key -> new ArrayList<>()).add(variable);
        }

        StringBuilder sb = new StringBuilder("# ").append(VARIABLES_HEADER).append("\n\n");
        for (Map.Entry<String, List<Variable>> entry : byNamespace.entrySet()) {
            sb.append("init python in ").append(entry.getKey()).append(":\n");
            for (Variable variable : entry.getValue()) {
                String description = variable.getDescription();
                if (description != null && !description.isBlank()) {
                    for (String line : description.replace("\r", "").split("\n")) {
                        if (!line.isBlank()) {
                            sb.append("    # ").append(line.strip()).append('\n');
                        }
                    }
                }
                sb.append("    ").append(variable.getName()).append(" = ").append(variableValue(variable)).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String storeName(String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            return "store";
        }
        return Character.toLowerCase(namespace.charAt(0)) + namespace.substring(1);
    }

    static String variableValue(Variable variable) {
        String type = variable.getType() != null ? variable.getType() : "";
        String value = variable.getValue() != null ? variable.getValue().strip() : "";
        String qualified = variable.getNamespace() + "." + variable.getName();
        switch (type) {
            case "Boolean":
                return "true".equalsIgnoreCase(value) ? "True" : "False";
            case "Integer":
                try {
                    return String.valueOf(Long.parseLong(value.isEmpty() ? "0" : value));
                } catch (NumberFormatException e) {
                    throw new CompilationException(null,
                        "Variable " + qualified + " has invalid Integer value \"" + value + "\"");
                }
            case "String":
                return pythonString(variable.getValue() != null ? variable.getValue() : "");
            default:
                throw new CompilationException(null,
                    "Variable " + qualified + " has unsupported type \"" + type + "\"");
        }
    }

    static String pythonValue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? "True" : "False";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        return pythonString(value != null ? value.toString() : "");
    }

    static String pythonString(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
