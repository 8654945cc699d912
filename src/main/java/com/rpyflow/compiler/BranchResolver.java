package com.rpyflow.compiler;

import com.rpyflow.LogAggregator;
import com.rpyflow.directives.DirectiveSchema;
import com.rpyflow.directives.DirectiveSet;
import com.rpyflow.models.Connection;
import com.rpyflow.models.FlowNode;
import com.rpyflow.models.Pin;
import com.rpyflow.models.ScriptLine;
import com.rpyflow.render.ScriptExpressions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Emits the control flow that leaves a node: a jump when there is at most one target,
 * a {@code menu:} when there are several.
 */
public class BranchResolver {

    private final CompilationContext context;

    public BranchResolver(CompilationContext context) {
        this.context = context;
    }

    /**
     * Control flow at the end of a node's block.
     */
    public List<ScriptLine> resolve(FlowNode node, DirectiveSet directives, LogAggregator.Scope scope) {
        return pathLines(outgoingPin(node), 1, directives, scope);
    }

    /**
     * Instructions of {@code pin} followed by the jump or menu it leads to, at the given depth.
     * A missing pin, or one without a reachable target, jumps to the end label.
     */
    public List<ScriptLine> pathLines(Pin pin, int depth, DirectiveSet directives, LogAggregator.Scope scope) {
        List<ScriptLine> lines = new ArrayList<>();
        if (pin == null) {
            lines.add(endJump(depth, scope));
            return lines;
        }
        for (String statement : ScriptExpressions.statements(pin.getText())) {
            lines.add(ScriptLine.of(depth, "$ " + statement));
        }
        List<Branch> branches = branches(pin);
        if (branches.isEmpty()) {
            lines.add(endJump(depth, scope));
        } else if (branches.size() == 1) {
            lines.add(ScriptLine.jump(depth, branches.get(0).node().getId()));
        } else {
            lines.addAll(menu(branches, depth, directives));
        }
        return lines;
    }

    /**
     * Containers continue into their content through the input pin; when they are empty, and for
     * every other node, the flow leaves through the first output pin.
     */
    Pin outgoingPin(FlowNode node) {
        if (node.getKind().isContainer()) {
            Pin input = node.firstInputPin();
            if (input != null && input.hasConnections()) {
                return input;
            }
        }
        return node.getOutputPins().isEmpty() ? null : node.getOutputPins().get(0);
    }

    /**
     * Resolved targets of a pin in discovery order, one per target node.
     */
    List<Branch> branches(Pin pin) {
        List<Branch> branches = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Connection connection : pin.getConnections()) {
            Optional<PinResolver.Target> target = context.getPinResolver().resolve(connection);
            if (target.isEmpty() || !seen.add(target.get().node().getId())) {
                continue;
            }
            branches.add(new Branch(connection, target.get()));
        }
        return branches;
    }

    private List<ScriptLine> menu(List<Branch> branches, int depth, DirectiveSet directives) {
        List<Branch> ordered = new ArrayList<>(branches);
        // List.sort is stable, so equal indices keep discovery order
        ordered.sort(Comparator.comparing(this::choiceIndex, Comparator.nullsLast(Comparator.naturalOrder())));

        List<ScriptLine> lines = new ArrayList<>();
        lines.add(ScriptLine.of(depth, "menu:"));
        if (directives.getBoolean(DirectiveSchema.DISPLAY_TEXT_BOX)) {
            // keeps the last line of dialogue in the text box while the choices are shown
            lines.add(ScriptLine.of(depth + 1, "extend \"\""));
        }
        for (Branch branch : ordered) {
            String text = choiceText(branch);
            Pin entry = branch.target().inputPin();
            String condition = entry != null ? ScriptExpressions.condition(entry.getText()) : "";
            if (condition.isEmpty()) {
                lines.add(ScriptLine.of(depth + 1, "\"" + text + "\":"));
            } else {
                lines.add(ScriptLine.of(depth + 1, "\"" + text + "\" if " + condition + ":"));
            }
            lines.add(ScriptLine.jump(depth + 2, branch.node().getId()));
        }
        return lines;
    }

    private Integer choiceIndex(Branch branch) {
        return context.directivesOf(branch.node()).getInt(DirectiveSchema.CHOICE_INDEX);
    }

    /**
     * Menu text of the target, else the connection label, else the target's text.
     */
    String choiceText(Branch branch) {
        FlowNode target = branch.node();
        boolean markdown = context.directivesOf(target).getBoolean(DirectiveSchema.MARKDOWN);
        if (target.hasMenuText()) {
            return context.getRenderer().choice(target.getMenuText(), markdown);
        }
        if (branch.connection().hasLabel()) {
            return context.getRenderer().choice(branch.connection().getLabel(), markdown);
        }
        if (target.hasText()) {
            return context.getRenderer().choice(target.getText(), markdown);
        }
        throw new CompilationException(target.getId(),
            "Node " + target.getId() + " is a menu choice but has no menu text, connection label or text");
    }

    private ScriptLine endJump(int depth, LogAggregator.Scope scope) {
        String end = context.getSettings().getEndLabel();
        scope.report("was not assigned any jump target in Articy, will jump to \"" + end + "\"");
        return ScriptLine.of(depth, "jump " + end);
    }

    record Branch(Connection connection, PinResolver.Target target) {
        FlowNode node() {
            return target.node();
        }
    }
}
