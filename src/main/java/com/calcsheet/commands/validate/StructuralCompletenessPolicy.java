package com.calcsheet.commands.validate;

import com.calcsheet.commands.AddAnnotationCommand;
import com.calcsheet.commands.AddTextCommand;
import com.calcsheet.commands.CommandAction;
import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.models.AnnotationNode;
import com.calcsheet.models.NodeType;
import com.calcsheet.models.TextNode;
import com.calcsheet.models.WorksheetNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Equation proposals need context: a plain-language restatement ({@code add_text}) and a diagram
 * annotation holding a fenced sketch of at least three non-empty lines. Either may already be
 * present in the document.
 */
public final class StructuralCompletenessPolicy {

    static final String MISSING_RESTATEMENT = "a problem restatement (`add_text`)";
    static final String MISSING_DIAGRAM =
        "a diagram (`add_annotation`) with a fenced ASCII sketch (at least 3 lines)";
    static final int MIN_SKETCH_LINES = 3;

    private static final Pattern DIAGRAM_VOCABULARY = Pattern.compile(
        "(diagram|schematic|free[- ]?body|fbd|sketch)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SKETCH_FENCE = Pattern.compile(
        "```(?:text|ascii)?\\s*\\n([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    private StructuralCompletenessPolicy() {
    }

    /**
     * @return the violation message, or null when the batch needs no context or already has it
     */
    public static String check(List<? extends WorksheetCommand> commands, List<WorksheetNode> existingNodes) {
        boolean needsContext = false;
        boolean hasRestatement = false;
        boolean hasDiagram = false;
        for (WorksheetCommand command : commands) {
            if (command.getAction() == CommandAction.ADD_EQUATION) {
                needsContext = true;
            } else if (command.getAction() == CommandAction.ADD_TEXT) {
                hasRestatement |= !isBlank(((AddTextCommand) command).getContent());
            } else if (command.getAction() == CommandAction.ADD_ANNOTATION) {
                AddAnnotationCommand annotation = (AddAnnotationCommand) command;
                hasDiagram |= isDiagramLike(annotation.getTitle(), annotation.getContent());
            }
        }
        if (!needsContext) {
            return null;
        }
        for (WorksheetNode node : existingNodes) {
            if (node.getType() == NodeType.TEXT) {
                hasRestatement |= !isBlank(((TextNode) node).getContent());
            } else if (node.getType() == NodeType.ANNOTATION) {
                AnnotationNode annotation = (AnnotationNode) node;
                hasDiagram |= isDiagramLike(annotation.getTitle(), annotation.getContent());
            }
        }
        if (hasRestatement && hasDiagram) {
            return null;
        }
        List<String> missing = new ArrayList<>();
        if (!hasRestatement) {
            missing.add(MISSING_RESTATEMENT);
        }
        if (!hasDiagram) {
            missing.add(MISSING_DIAGRAM);
        }
        return "Equation proposals must include " + String.join(" and ", missing) + ".";
    }

    /**
     * Diagram vocabulary in the title or body, plus a sketch fence with enough non-empty lines.
     */
    public static boolean isDiagramLike(String title, String content) {
        String safeTitle = title != null ? title : "";
        String safeContent = content != null ? content : "";
        boolean labelled = DIAGRAM_VOCABULARY.matcher(safeTitle).find()
            || DIAGRAM_VOCABULARY.matcher(safeContent).find();
        if (!labelled) {
            return false;
        }
        Matcher fence = SKETCH_FENCE.matcher(safeContent);
        if (!fence.find()) {
            return false;
        }
        int lines = 0;
        for (String line : fence.group(1).split("\n")) {
            if (!line.trim().isEmpty()) {
                lines++;
            }
        }
        return lines >= MIN_SKETCH_LINES;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
