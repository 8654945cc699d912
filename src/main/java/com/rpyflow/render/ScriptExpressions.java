package com.rpyflow.render;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts Articy expression syntax (conditions and instructions) to Python.
 */
public final class ScriptExpressions {

    private static final Pattern NEGATION = Pattern.compile("!(?!=)\\s*");
    private static final Pattern AND = Pattern.compile("\\s*&&\\s*");
    private static final Pattern OR = Pattern.compile("\\s*\\|\\|\\s*");
    private static final Pattern TRUE_LITERAL = Pattern.compile("\\btrue\\b");
    private static final Pattern FALSE_LITERAL = Pattern.compile("\\bfalse\\b");

    private ScriptExpressions() {}

    public static String toPython(String expression) {
        if (expression == null) {
            return "";
        }
        String converted = TRUE_LITERAL.matcher(expression).replaceAll("True");
        converted = FALSE_LITERAL.matcher(converted).replaceAll("False");
        converted = AND.matcher(converted).replaceAll(" and ");
        converted = OR.matcher(converted).replaceAll(" or ");
        Matcher m = NEGATION.matcher(converted);
        converted = m.replaceAll("not ");
        return converted.trim();
    }

    /**
     * A condition on one line, ready for an {@code if} statement. Empty when there is no condition.
     */
    public static String condition(String expression) {
        if (expression == null || expression.isBlank()) {
            return "";
        }
        return toPython(expression.replace('\r', ' ').replace('\n', ' '));
    }

    /**
     * The {@code ;}-separated statements of an instruction, converted and trimmed.
     */
    public static List<String> statements(String expression) {
        List<String> statements = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return statements;
        }
        String flat = expression.replace("\r", "").replace("\n", "");
        for (String part : flat.split(";")) {
            String statement = toPython(part);
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }
}
