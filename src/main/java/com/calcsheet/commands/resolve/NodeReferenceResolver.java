package com.calcsheet.commands.resolve;

import com.calcsheet.AppLogger;
import com.calcsheet.commands.NodeTargetCommand;
import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.context.ChatContextBuilder;
import com.calcsheet.document.DocumentModel;
import com.calcsheet.models.AnnotationNode;
import com.calcsheet.models.EquationNode;
import com.calcsheet.models.GivenNode;
import com.calcsheet.models.NodeType;
import com.calcsheet.models.ResultNode;
import com.calcsheet.models.SolveGoalNode;
import com.calcsheet.models.WorksheetNode;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites human-authored node references into node ids.
 *
 * Resolution order, first match wins:
 * <ol>
 *   <li>exact node id</li>
 *   <li>exact symbol: given/result symbol or equation lhs</li>
 *   <li>case-insensitive id prefix (short ids)</li>
 *   <li>{@code <type>_<n>}, the n-th node of that type in document order</li>
 *   <li>case-insensitive symbol, annotation title, a published alias ({@code solve_<target>},
 *       underscored annotation title) or the literal {@code diagram}</li>
 * </ol>
 * An unresolved reference comes back normalized but otherwise unchanged, so "not found"
 * messages show what the model wrote.
 */
public class NodeReferenceResolver {

    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^['\"`]+|['\"`]+$");
    private static final Pattern NODE_PREFIX = Pattern.compile("^node\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern REF_PREFIX = Pattern.compile("^ref:", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_ELLIPSIS = Pattern.compile("\\.\\.\\.$");
    private static final Pattern TYPE_ORDINAL = Pattern.compile(
        "^(text|annotation|given|equation|constraint|solve[_-]?goal|result|plot)[ _-]?(\\d+)$");
    private static final String DIAGRAM = "diagram";

    private final DocumentModel document;
    private final AppLogger logger;

    public NodeReferenceResolver(DocumentModel document) {
        this.document = document;
        this.logger = AppLogger.get();
    }

    /**
     * Resolves the {@code node_id} of every node-targeting command in place.
     */
    public void resolveAll(List<? extends WorksheetCommand> commands) {
        for (WorksheetCommand command : commands) {
            if (command instanceof NodeTargetCommand) {
                NodeTargetCommand target = (NodeTargetCommand) command;
                String raw = target.getNodeId();
                if (raw == null) {
                    continue;
                }
                String resolved = resolve(raw);
                if (!raw.equals(resolved)) {
                    logger.info("[NodeReferenceResolver] " + command.getAction().getWireName()
                        + ": '" + raw + "' -> " + resolved);
                }
                target.setNodeId(resolved);
            }
        }
    }

    public String resolve(String ref) {
        if (ref == null) {
            return null;
        }
        String normalized = normalize(ref);
        if (normalized.isEmpty()) {
            return ref;
        }
        List<WorksheetNode> nodes = document.getNodes();

        for (WorksheetNode node : nodes) {
            if (normalized.equals(node.getId())) {
                return node.getId();
            }
        }

        for (WorksheetNode node : nodes) {
            if (normalized.equals(symbolOf(node))) {
                return node.getId();
            }
        }

        String lower = normalized.toLowerCase(Locale.ROOT);
        for (WorksheetNode node : nodes) {
            if (node.getId() != null && node.getId().toLowerCase(Locale.ROOT).startsWith(lower)) {
                return node.getId();
            }
        }

        String byOrdinal = resolveByTypeOrdinal(lower, nodes);
        if (byOrdinal != null) {
            return byOrdinal;
        }

        for (WorksheetNode node : nodes) {
            if (matchesLoosely(node, lower)) {
                return node.getId();
            }
        }
        return normalized;
    }

    /**
     * Trims, then strips surrounding quotes, a leading {@code node } or {@code ref:} and a trailing ellipsis.
     */
    static String normalize(String ref) {
        String value = ref.trim();
        value = SURROUNDING_QUOTES.matcher(value).replaceAll("");
        value = NODE_PREFIX.matcher(value).replaceFirst("");
        value = REF_PREFIX.matcher(value).replaceFirst("");
        value = TRAILING_ELLIPSIS.matcher(value).replaceFirst("");
        return value.trim();
    }

    private static String resolveByTypeOrdinal(String lower, List<WorksheetNode> nodes) {
        Matcher m = TYPE_ORDINAL.matcher(lower);
        if (!m.matches()) {
            return null;
        }
        NodeType type = NodeType.fromWire(m.group(1));
        int index;
        try {
            index = Integer.parseInt(m.group(2)) - 1;
        } catch (NumberFormatException e) {
            return null;
        }
        if (type == null || index < 0) {
            return null;
        }
        int seen = 0;
        for (WorksheetNode node : nodes) {
            if (node.getType() == type) {
                if (seen == index) {
                    return node.getId();
                }
                seen++;
            }
        }
        return null;
    }

    private static String symbolOf(WorksheetNode node) {
        switch (node.getType()) {
            case GIVEN:
                return ((GivenNode) node).getSymbol();
            case RESULT:
                return ((ResultNode) node).getSymbol();
            case EQUATION:
                return ((EquationNode) node).getLhs();
            default:
                return null;
        }
    }

    private static boolean matchesLoosely(WorksheetNode node, String lower) {
        if (node.getType() == NodeType.ANNOTATION) {
            AnnotationNode annotation = (AnnotationNode) node;
            String title = annotation.getTitle() != null ? annotation.getTitle().toLowerCase(Locale.ROOT) : null;
            if (lower.equals(title) || (title != null && lower.equals(ChatContextBuilder.sanitizeAlias(title)))) {
                return true;
            }
            if (DIAGRAM.equals(lower)) {
                String content = annotation.getContent() != null ? annotation.getContent().toLowerCase(Locale.ROOT) : "";
                return (title != null && title.contains(DIAGRAM)) || content.contains(DIAGRAM);
            }
            return false;
        }
        if (node.getType() == NodeType.SOLVE_GOAL) {
            String target = ((SolveGoalNode) node).getTargetSymbol();
            return target != null && lower.equals("solve_" + ChatContextBuilder.sanitizeAlias(target));
        }
        String symbol = symbolOf(node);
        return symbol != null && symbol.toLowerCase(Locale.ROOT).equals(lower);
    }
}
