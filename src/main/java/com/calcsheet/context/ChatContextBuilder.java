package com.calcsheet.context;

import com.calcsheet.models.AnnotationNode;
import com.calcsheet.models.Assumption;
import com.calcsheet.models.ConstraintNode;
import com.calcsheet.models.EquationNode;
import com.calcsheet.models.GivenNode;
import com.calcsheet.models.NodeType;
import com.calcsheet.models.PlotNode;
import com.calcsheet.models.ResultNode;
import com.calcsheet.models.SolveGoalNode;
import com.calcsheet.models.TextNode;
import com.calcsheet.models.ValueWithUnit;
import com.calcsheet.models.WorksheetNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the chat context: known symbols, equations, active assumptions and node refs.
 * When refs must be trimmed, meaningful types (given, result, equation) are kept first.
 */
public class ChatContextBuilder {

    public static final int DEFAULT_MAX_NODE_REFS = 80;
    static final int MAX_LABEL_LENGTH = 90;

    static final String INSTRUCTIONS = "You are helping with an engineering calculation worksheet. "
        + "Propose edits as fenced ```json blocks using the command protocol "
        + "(add_given, add_equation, add_constraint, add_solve_goal, add_text, add_annotation, "
        + "update_node, delete_node, add_assumption, remove_assumption, verify_node, verify_all). "
        + "Every value must have correct units; the engine verifies proposals before they are applied. "
        + "Equation proposals must include a problem restatement (add_text) and a diagram annotation "
        + "with a fenced ASCII sketch. Target existing nodes by the ref or aliases listed in node_refs.";

    private static final NodeType[] PRIORITY_ORDER = {
        NodeType.GIVEN, NodeType.RESULT, NodeType.EQUATION, NodeType.SOLVE_GOAL,
        NodeType.CONSTRAINT, NodeType.ANNOTATION, NodeType.TEXT, NodeType.PLOT
    };

    public ChatContext build(List<WorksheetNode> nodes, List<Assumption> assumptions,
                             String focusNodeId, String query) {
        return build(nodes, assumptions, focusNodeId, query, DEFAULT_MAX_NODE_REFS);
    }

    public ChatContext build(List<WorksheetNode> nodes, List<Assumption> assumptions,
                             String focusNodeId, String query, int maxNodeRefs) {
        Map<String, ChatContext.SymbolEntry> symbols = new LinkedHashMap<>();
        List<String> equations = new ArrayList<>();
        List<NodeRef> allRefs = new ArrayList<>();
        Map<NodeType, Integer> ordinals = new EnumMap<>(NodeType.class);

        for (int i = 0; i < nodes.size(); i++) {
            WorksheetNode node = nodes.get(i);
            int ordinal = ordinals.merge(node.getType(), 1, Integer::sum);

            if (node.getType() == NodeType.GIVEN) {
                GivenNode given = (GivenNode) node;
                symbols.put(given.getSymbol(), symbolEntry(given.getValue(), given.getId()));
            } else if (node.getType() == NodeType.RESULT) {
                ResultNode result = (ResultNode) node;
                symbols.put(result.getSymbol(), symbolEntry(result.getValue(), result.getId()));
            } else if (node.getType() == NodeType.EQUATION) {
                EquationNode eq = (EquationNode) node;
                equations.add(eq.getLhs() + " = " + eq.getRhs());
            }
            allRefs.add(buildNodeRef(node, ordinal, i + 1));
        }

        List<String> activeAssumptions = new ArrayList<>();
        for (Assumption assumption : assumptions) {
            if (assumption.isActive()) {
                activeAssumptions.add(assumption.getStatement());
            }
        }

        List<NodeRef> ordered = new ArrayList<>();
        for (NodeType type : PRIORITY_ORDER) {
            for (NodeRef ref : allRefs) {
                if (ref.getType() == type) {
                    ordered.add(ref);
                }
            }
        }
        int limit = Math.min(ordered.size(), Math.max(1, maxNodeRefs));
        List<NodeRef> refs = new ArrayList<>(ordered.subList(0, limit));

        return new ChatContext(symbols, equations, activeAssumptions, refs, focusNodeId, query, INSTRUCTIONS);
    }

    NodeRef buildNodeRef(WorksheetNode node, int ordinal, int index) {
        String ordinalAlias = node.getType().getWireName() + "_" + ordinal;
        Set<String> aliases = new LinkedHashSet<>();
        aliases.add(ordinalAlias);
        String ref = ordinalAlias;

        switch (node.getType()) {
            case GIVEN:
                ref = ((GivenNode) node).getSymbol();
                aliases.add(ref);
                break;
            case RESULT:
                ref = ((ResultNode) node).getSymbol();
                aliases.add(ref);
                break;
            case EQUATION:
                String lhs = ((EquationNode) node).getLhs();
                if (lhs != null && !lhs.trim().isEmpty()) {
                    ref = lhs.trim();
                    aliases.add(ref);
                }
                break;
            case SOLVE_GOAL:
                ref = "solve_" + sanitizeAlias(((SolveGoalNode) node).getTargetSymbol());
                aliases.add(ref);
                break;
            case ANNOTATION:
                String title = ((AnnotationNode) node).getTitle();
                if (title != null && !title.trim().isEmpty()) {
                    aliases.add(sanitizeAlias(title));
                }
                break;
            default:
                break;
        }
        aliases.removeIf(alias -> alias == null || alias.isEmpty());

        String label = summarize(node);
        if (label.length() > MAX_LABEL_LENGTH) {
            label = label.substring(0, MAX_LABEL_LENGTH - 3) + "...";
        }
        return new NodeRef(node.getId(), node.getType(), index, ref, new ArrayList<>(aliases), label);
    }

    /**
     * Lowercase alias with runs of other characters collapsed to {@code _}.
     */
    public static String sanitizeAlias(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).trim()
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
    }

    /**
     * One-line human-readable summary of a node.
     */
    static String summarize(WorksheetNode node) {
        switch (node.getType()) {
            case GIVEN:
                GivenNode given = (GivenNode) node;
                return given.getSymbol() + " := " + given.getValue();
            case RESULT:
                ResultNode result = (ResultNode) node;
                String from = result.getSymbolicForm() != null ? " (from " + result.getSymbolicForm() + ")" : "";
                return result.getSymbol() + " := " + result.getValue() + from;
            case EQUATION:
                EquationNode eq = (EquationNode) node;
                return eq.getLhs() + " = " + eq.getRhs();
            case CONSTRAINT:
                ConstraintNode constraint = (ConstraintNode) node;
                return "constraint: " + (constraint.getDescription() != null
                    ? constraint.getDescription() : constraint.getSympy());
            case SOLVE_GOAL:
                return "solve for: " + ((SolveGoalNode) node).getTargetSymbol();
            case TEXT:
                String content = nullToEmpty(((TextNode) node).getContent());
                return "text: \"" + head(content, 60) + (content.length() > 60 ? "..." : "") + "\"";
            case ANNOTATION:
                AnnotationNode annotation = (AnnotationNode) node;
                String shown = annotation.getTitle() != null ? annotation.getTitle() : nullToEmpty(annotation.getContent());
                return "note: \"" + head(shown, 60) + "\"";
            case PLOT:
                return "plot: " + String.join(", ", ((PlotNode) node).getExpressions());
            default:
                return "[" + node.getType().getWireName() + "]";
        }
    }

    private static ChatContext.SymbolEntry symbolEntry(ValueWithUnit value, String nodeId) {
        if (value == null) {
            return new ChatContext.SymbolEntry(0, null, nodeId);
        }
        return new ChatContext.SymbolEntry(value.getValue(), value.hasUnit() ? value.getUnit() : null, nodeId);
    }

    private static String head(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
