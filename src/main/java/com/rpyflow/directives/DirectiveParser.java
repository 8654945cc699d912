package com.rpyflow.directives;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class DirectiveParser {

    private final DirectiveSchema schema;

    public DirectiveParser(DirectiveSchema schema) {
        this.schema = schema;
    }

    public DirectiveSet parse(String raw) {
        Map<String, Object> values = schema.defaults();
        List<String> warnings = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return new DirectiveSet(values, warnings);
        }
        for (String segment : splitTopLevel(raw)) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            String key;
            String value;
            if (eq < 0) {
                if (isInteger(trimmed) && schema.has(DirectiveSchema.CHOICE_INDEX)) {
                    // A lone number is the legacy way of giving the choice index
                    key = DirectiveSchema.CHOICE_INDEX;
                    value = trimmed;
                } else {
                    key = normalizeKey(trimmed);
                    value = null;
                }
            } else {
                key = normalizeKey(trimmed.substring(0, eq));
                value = unquote(trimmed.substring(eq + 1).trim());
            }
            DirectiveSpec spec = schema.get(key);
            if (spec == null) {
                warnings.add("ignores unknown directive \"" + key + "\"");
                continue;
            }
            if (value == null && spec.getType() != DirectiveSpec.Type.BOOLEAN) {
                warnings.add("directive \"" + key + "\" requires a value");
                continue;
            }
            Object coerced = spec.coerce(value);
            if (coerced == null) {
                warnings.add("has invalid value \"" + value + "\" for directive \"" + key + "\", using default");
                continue;
            }
            values.put(key, coerced);
        }
        return new DirectiveSet(values, warnings);
    }

    /**
     * Splits on commas that are not inside a quoted value. A quote only opens when it is the first
     * non-blank character of a segment or of the value after {@code =}, so apostrophes inside
     * unquoted text stay literal.
     */
    static List<String> splitTopLevel(String raw) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean valueStart = true;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
            } else if (c == ',') {
                parts.add(current.toString());
                current.setLength(0);
                valueStart = true;
            } else {
                if (valueStart && (c == '"' || c == '\'')) {
                    quote = c;
                }
                if (c == '=') {
                    valueStart = true;
                } else if (!Character.isWhitespace(c)) {
                    valueStart = false;
                }
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    private String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }

    private String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private boolean isInteger(String value) {
        try {
            Integer.parseInt(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
