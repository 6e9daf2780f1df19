package com.calcsheet.commands.placement;

import com.calcsheet.AppLogger;
import com.calcsheet.commands.AddAnnotationCommand;
import com.calcsheet.commands.AddTextCommand;
import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.models.AnnotationNode;
import com.calcsheet.models.NodePosition;
import com.calcsheet.models.TextNode;
import com.calcsheet.models.WorksheetNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns grid-aligned positions to the nodes a batch creates so that no estimated box overlaps
 * an existing node or another node of the same batch. New nodes stack in one column below the
 * lowest existing node.
 */
public class PlacementPlanner {

    public static final int GRID_SIZE = 40;
    public static final double DEFAULT_X = 100;
    public static final double DEFAULT_Y = 100;
    public static final int VERTICAL_GAP = 24;
    public static final int OVERLAP_MARGIN_X = 16;
    public static final int OVERLAP_MARGIN_Y = 16;
    public static final int MAX_PLACEMENT_STEPS = 2000;

    static final NodeBox STANDARD_BOX = new NodeBox(0, 0, 260, 88);
    static final NodeBox PLOT_BOX = new NodeBox(0, 0, 520, 340);
    static final double TEXT_BOX_WIDTH = 620;
    static final double ANNOTATION_BOX_WIDTH = 620;
    static final double COLLAPSED_ANNOTATION_HEIGHT = 72;

    private final AppLogger logger;

    public PlacementPlanner() {
        this.logger = AppLogger.get();
    }

    /**
     * @return one entry per command; null for commands that create no node
     */
    public List<NodePosition> planBatchNodePositions(List<? extends WorksheetCommand> commands,
                                                     List<WorksheetNode> existingNodes) {
        List<NodePosition> positions = new ArrayList<>();
        if (commands.isEmpty()) {
            return positions;
        }
        NodePosition start = batchStartPosition(existingNodes);
        List<NodeBox> occupied = occupiedBoxes(existingNodes);
        double cursorY = start.getY();

        for (WorksheetCommand command : commands) {
            NodeBox box = command.getAction().createsNode() ? estimateCommandBox(command) : null;
            if (box == null) {
                positions.add(null);
                continue;
            }
            double y = findFirstClearY(start.getX(), cursorY, box, occupied);
            positions.add(new NodePosition(start.getX(), y));
            occupied.add(box.at(start.getX(), y));
            cursorY = snapToGrid(y + box.getHeight() + VERTICAL_GAP);
        }
        logger.info("[PlacementPlanner] Planned " + countPlanned(positions) + " position(s) from " + start);
        return positions;
    }

    public static double snapToGrid(double value) {
        return Math.ceil(value / GRID_SIZE) * GRID_SIZE;
    }

    /**
     * Lines of text after wrapping at {@code charsPerLine}; blank text counts as one line.
     */
    static int estimateWrappedLines(String text, int charsPerLine) {
        if (text == null || text.trim().isEmpty()) {
            return 1;
        }
        int total = 0;
        for (String line : text.split("\\r?\\n", -1)) {
            total += Math.max(1, (int) Math.ceil(line.trim().length() / (double) charsPerLine));
        }
        return total;
    }

    static NodeBox estimateTextBox(String content) {
        int lines = estimateWrappedLines(content, 88);
        return new NodeBox(0, 0, TEXT_BOX_WIDTH, Math.max(84, 56 + lines * 24));
    }

    static NodeBox estimateAnnotationBox(String content) {
        int lines = estimateWrappedLines(content, 84);
        int fenceBonus = content != null && content.contains("```") ? 40 : 0;
        return new NodeBox(0, 0, ANNOTATION_BOX_WIDTH, Math.max(112, 72 + lines * 20 + fenceBonus));
    }

    /**
     * Estimated box of an existing node, placed at its position.
     */
    public static NodeBox estimateNodeBox(WorksheetNode node) {
        NodeBox box;
        switch (node.getType()) {
            case TEXT:
                box = estimateTextBox(((TextNode) node).getContent());
                break;
            case ANNOTATION:
                AnnotationNode annotation = (AnnotationNode) node;
                box = annotation.isCollapsed()
                    ? new NodeBox(0, 0, ANNOTATION_BOX_WIDTH, COLLAPSED_ANNOTATION_HEIGHT)
                    : estimateAnnotationBox(annotation.getContent());
                break;
            case PLOT:
                box = PLOT_BOX;
                break;
            default:
                box = STANDARD_BOX;
                break;
        }
        NodePosition position = node.getPosition();
        return position != null
            ? box.at(position.getX(), position.getY())
            : box.at(DEFAULT_X, DEFAULT_Y);
    }

    /**
     * Estimated size of the node a command will create, or null when it creates none.
     */
    public static NodeBox estimateCommandBox(WorksheetCommand command) {
        switch (command.getAction()) {
            case ADD_TEXT:
                return estimateTextBox(((AddTextCommand) command).getContent());
            case ADD_ANNOTATION:
                return estimateAnnotationBox(((AddAnnotationCommand) command).getContent());
            case ADD_GIVEN:
            case ADD_EQUATION:
            case ADD_CONSTRAINT:
            case ADD_SOLVE_GOAL:
                return STANDARD_BOX;
            default:
                return null;
        }
    }

    static NodePosition batchStartPosition(List<WorksheetNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return new NodePosition(DEFAULT_X, DEFAULT_Y);
        }
        NodePosition first = nodes.get(0).getPosition();
        double x = first != null ? first.getX() : DEFAULT_X;
        double maxBottom = DEFAULT_Y - VERTICAL_GAP;
        for (WorksheetNode node : nodes) {
            NodeBox box = estimateNodeBox(node);
            double y = node.getPosition() != null ? node.getPosition().getY() : DEFAULT_Y;
            maxBottom = Math.max(maxBottom, y + box.getHeight());
        }
        return new NodePosition(x, snapToGrid(maxBottom + VERTICAL_GAP));
    }

    private static List<NodeBox> occupiedBoxes(List<WorksheetNode> nodes) {
        List<NodeBox> boxes = new ArrayList<>();
        if (nodes != null) {
            for (WorksheetNode node : nodes) {
                boxes.add(estimateNodeBox(node));
            }
        }
        return boxes;
    }

    private static double findFirstClearY(double x, double startY, NodeBox box, List<NodeBox> occupied) {
        double y = snapToGrid(startY);
        for (int i = 0; i < MAX_PLACEMENT_STEPS; i++) {
            NodeBox candidate = box.at(x, y);
            if (!overlapsAny(candidate, occupied)) {
                return y;
            }
            y += GRID_SIZE;
        }
        return y;
    }

    private static boolean overlapsAny(NodeBox candidate, List<NodeBox> occupied) {
        for (NodeBox rect : occupied) {
            if (candidate.overlaps(rect, OVERLAP_MARGIN_X, OVERLAP_MARGIN_Y)) {
                return true;
            }
        }
        return false;
    }

    private static int countPlanned(List<NodePosition> positions) {
        int count = 0;
        for (NodePosition position : positions) {
            if (position != null) {
                count++;
            }
        }
        return count;
    }
}
