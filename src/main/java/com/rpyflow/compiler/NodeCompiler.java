package com.rpyflow.compiler;

import com.rpyflow.LogAggregator;
import com.rpyflow.directives.DirectiveSchema;
import com.rpyflow.directives.DirectiveSet;
import com.rpyflow.models.CompiledBlock;
import com.rpyflow.models.FileUnit;
import com.rpyflow.models.FlowNode;
import com.rpyflow.models.NodeKind;
import com.rpyflow.models.Pin;
import com.rpyflow.models.ScriptLine;
import com.rpyflow.render.ScriptExpressions;
import com.rpyflow.render.TextRenderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles one node into a labelled block and registers its label.
 */
public class NodeCompiler {

    private final CompilationContext context;
    private final BranchResolver branchResolver;

    public NodeCompiler(CompilationContext context, BranchResolver branchResolver) {
        this.context = context;
        this.branchResolver = branchResolver;
    }

    /**
     * @return the block, or null for nodes that produce no code (comments and unsupported types)
     */
    public CompiledBlock compile(FlowNode node, FileUnit unit) {
        if (node.getKind() == NodeKind.COMMENT) {
            return null;
        }
        if (node.getKind() == NodeKind.UNSUPPORTED) {
            context.getLog().report(unit.getPath(), null,
                "Type \"" + node.getType() + "\" of model " + node.getId() + " is not supported");
            return null;
        }

        DirectiveSet directives = context.directivesOf(node);
        String label = labelFor(node, directives);
        context.getLabels().register(node.getId(), label);
        LogAggregator.Scope scope = context.getLog().scope(unit.getPath(), label);
        directives.getWarnings().forEach(scope::report);

        List<ScriptLine> lines = new ArrayList<>(comments(node));
        lines.addAll(guarded(node, content(node, directives, scope)));
        lines.addAll(flow(node, directives, scope));
        return new CompiledBlock(label, node.getId(), lines);
    }

    String labelFor(FlowNode node, DirectiveSet directives) {
        if (node.getKind() == NodeKind.ENTRY_POINT && node.hasText()) {
            return node.getText().strip();
        }
        String label = directives.getString(DirectiveSchema.LABEL);
        if (label != null && !label.isBlank()) {
            return label.strip();
        }
        return context.defaultLabel(node);
    }

    private List<ScriptLine> comments(FlowNode node) {
        List<ScriptLine> lines = new ArrayList<>();
        lines.add(ScriptLine.of(1, "# " + node.getType()));
        boolean expressionNode = node.getKind() == NodeKind.CONDITION || node.getKind() == NodeKind.INSTRUCTION;
        if (node.hasDisplayName() && !expressionNode) {
            lines.addAll(commentLines(node.getDisplayName()));
        }
        if (node.getDirectives() != null && !node.getDirectives().isBlank()) {
            lines.addAll(commentLines(node.getDirectives()));
        }
        if ((node.getKind() == NodeKind.CONTAINER || node.getKind() == NodeKind.HUB) && node.hasText()) {
            lines.addAll(commentLines(node.getText()));
        }
        return lines;
    }

    private List<ScriptLine> commentLines(String text) {
        List<ScriptLine> lines = new ArrayList<>();
        for (String line : text.replace("\r", "").split("\n")) {
            if (!line.isBlank()) {
                lines.add(ScriptLine.of(1, "# " + line.strip()));
            }
        }
        return lines;
    }

    private List<ScriptLine> content(FlowNode node, DirectiveSet directives, LogAggregator.Scope scope) {
        List<ScriptLine> lines = new ArrayList<>();
        switch (node.getKind()) {
            case DIALOGUE:
                lines.addAll(sayLines(node.getText(), node, directives));
                break;
            case RAW_CODE:
                String directory = context.directoryOf(node.getParentId());
                boolean relativeImages = directives.getBoolean(DirectiveSchema.RELATIVE_IMGS_IN_BRACES);
                for (String line : context.getRenderer().rawCode(node.getText(), directory, relativeImages, scope)) {
                    lines.add(ScriptLine.of(1, line));
                }
                if (directives.getBoolean(DirectiveSchema.REPEAT_MENU_TEXT) && node.hasMenuText()) {
                    lines.addAll(sayLines(node.getMenuText(), node, directives));
                }
                break;
            case INSTRUCTION:
                for (String statement : ScriptExpressions.statements(node.getExpression())) {
                    lines.add(ScriptLine.of(1, "$ " + statement));
                }
                break;
            default:
                break;
        }
        return lines;
    }

    /**
     * Wraps content in the condition attached to the node's input pin, if any.
     */
    private List<ScriptLine> guarded(FlowNode node, List<ScriptLine> content) {
        if (content.isEmpty()) {
            return content;
        }
        NodeKind kind = node.getKind();
        if (kind != NodeKind.DIALOGUE && kind != NodeKind.RAW_CODE && kind != NodeKind.INSTRUCTION) {
            return content;
        }
        Pin input = node.firstInputPin();
        String condition = input != null ? ScriptExpressions.condition(input.getText()) : "";
        if (condition.isEmpty()) {
            return content;
        }
        List<ScriptLine> lines = new ArrayList<>();
        lines.add(ScriptLine.of(1, "if " + condition + ":"));
        for (ScriptLine line : content) {
            lines.add(line.indented(1));
        }
        return lines;
    }

    private List<ScriptLine> flow(FlowNode node, DirectiveSet directives, LogAggregator.Scope scope) {
        switch (node.getKind()) {
            case JUMP:
                return jumpLines(node, scope);
            case CONDITION:
                return conditionLines(node, directives, scope);
            default:
                return branchResolver.resolve(node, directives, scope);
        }
    }

    private List<ScriptLine> jumpLines(FlowNode node, LogAggregator.Scope scope) {
        String target = node.getJumpTargetId();
        if (target == null || target.isBlank()) {
            String end = context.getSettings().getEndLabel();
            scope.report("was not assigned any jump target in Articy, will jump to \"" + end + "\"");
            return List.of(ScriptLine.of(1, "jump " + end));
        }
        return List.of(ScriptLine.jump(1, target));
    }

    private List<ScriptLine> conditionLines(FlowNode node, DirectiveSet directives, LogAggregator.Scope scope) {
        String condition = ScriptExpressions.condition(node.getExpression());
        if (condition.isEmpty()) {
            condition = "True";
        }
        List<Pin> pins = node.getOutputPins();
        List<ScriptLine> lines = new ArrayList<>();
        lines.add(ScriptLine.of(1, "if " + condition + ":"));
        lines.addAll(branchResolver.pathLines(pins.size() > 0 ? pins.get(0) : null, 2, directives, scope));
        lines.add(ScriptLine.of(1, "else:"));
        lines.addAll(branchResolver.pathLines(pins.size() > 1 ? pins.get(1) : null, 2, directives, scope));
        return lines;
    }

    /**
     * Say statements for each paragraph of {@code text}:
     * {@code [speaker ][before ]"text"[ after]}.
     */
    List<ScriptLine> sayLines(String text, FlowNode node, DirectiveSet directives) {
        List<ScriptLine> lines = new ArrayList<>();
        String speaker = speakerToken(node, directives);
        String before = directives.getString(DirectiveSchema.BEFORE);
        String after = directives.getString(DirectiveSchema.AFTER);
        boolean markdown = directives.getBoolean(DirectiveSchema.MARKDOWN);
        for (String paragraph : context.getRenderer().narration(text, markdown)) {
            StringBuilder sb = new StringBuilder();
            if (speaker != null) {
                sb.append(speaker).append(' ');
            }
            if (before != null && !before.isBlank()) {
                sb.append(before.strip()).append(' ');
            }
            sb.append('"').append(paragraph).append('"');
            if (after != null && !after.isBlank()) {
                sb.append(' ').append(after.strip());
            }
            lines.add(ScriptLine.of(1, sb.toString()));
        }
        return lines;
    }

    /**
     * A {@code speaker} directive wins over the entity's character; no entity means narration.
     */
    String speakerToken(FlowNode node, DirectiveSet directives) {
        String speaker = directives.getString(DirectiveSchema.SPEAKER);
        if (speaker != null && !speaker.isBlank()) {
            return "\"" + TextRenderer.escape(speaker.strip()) + "\"";
        }
        return context.characterToken(node.getSpeakerId());
    }
}
