package com.calcsheet.commands.execute;

import com.calcsheet.AppLogger;
import com.calcsheet.commands.AddAnnotationCommand;
import com.calcsheet.commands.AddAssumptionCommand;
import com.calcsheet.commands.AddConstraintCommand;
import com.calcsheet.commands.AddEquationCommand;
import com.calcsheet.commands.AddGivenCommand;
import com.calcsheet.commands.AddSolveGoalCommand;
import com.calcsheet.commands.AddTextCommand;
import com.calcsheet.commands.BatchResult;
import com.calcsheet.commands.CommandResult;
import com.calcsheet.commands.NodeTargetCommand;
import com.calcsheet.commands.RemoveAssumptionCommand;
import com.calcsheet.commands.UpdateNodeCommand;
import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.commands.placement.PlacementPlanner;
import com.calcsheet.document.DocumentModel;
import com.calcsheet.document.NodeFactory;
import com.calcsheet.math.ExpressionNormalizer;
import com.calcsheet.models.ConstraintNode;
import com.calcsheet.models.NodePosition;
import com.calcsheet.models.Provenance;
import com.calcsheet.models.WorksheetNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies an accepted batch in order. A failing command is recorded and the rest still run;
 * there is no rollback, so partial success is a normal outcome. Batches run one at a time,
 * so positions planned for one batch are never taken by another.
 */
public class CommandExecutor {

    private final DocumentModel document;
    private final PlacementPlanner planner;
    private final AppLogger logger;

    public CommandExecutor(DocumentModel document) {
        this(document, new PlacementPlanner());
    }

    public CommandExecutor(DocumentModel document, PlacementPlanner planner) {
        this.document = document;
        this.planner = planner;
        this.logger = AppLogger.get();
    }

    /**
     * Plans positions against the current document, then executes.
     */
    public synchronized BatchResult executeBatch(List<? extends WorksheetCommand> commands) {
        List<NodePosition> positions = planner.planBatchNodePositions(commands, document.getNodes());
        return executeBatch(commands, positions);
    }

    /**
     * @param positions planned position per command, null entries for commands that create no node
     */
    public synchronized BatchResult executeBatch(List<? extends WorksheetCommand> commands, List<NodePosition> positions) {
        List<CommandResult> results = new ArrayList<>();
        for (int i = 0; i < commands.size(); i++) {
            NodePosition position = positions != null && i < positions.size() ? positions.get(i) : null;
            results.add(executeOne(commands.get(i), position));
        }
        BatchResult batch = new BatchResult(results);
        logger.info("[CommandExecutor] Batch done: " + batch.getSucceeded() + "/" + batch.getTotal()
            + " succeeded, " + batch.getFailed() + " failed");
        return batch;
    }

    CommandResult executeOne(WorksheetCommand command, NodePosition position) {
        String action = command.getAction().getWireName();
        try {
            String nodeId = apply(command, position);
            logger.info("[CommandExecutor] " + action + " ok" + (nodeId != null ? " (" + nodeId + ")" : ""));
            return CommandResult.success(command, nodeId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("[CommandExecutor] " + action + " interrupted");
            return CommandResult.failure(command, describe(e));
        } catch (Exception e) {
            logger.warn("[CommandExecutor] " + action + " failed: " + describe(e));
            return CommandResult.failure(command, describe(e));
        }
    }

    /**
     * @return id of the node created or addressed, if any
     */
    private String apply(WorksheetCommand command, NodePosition position) throws Exception {
        switch (command.getAction()) {
            case ADD_GIVEN:
                AddGivenCommand given = (AddGivenCommand) command;
                String unit = given.getUnit() != null && !given.getUnit().isEmpty()
                    ? CommandSanitizer.sanitizeUnit(given.getUnit()) : null;
                return insert(NodeFactory.given(CommandSanitizer.sanitizeSymbol(given.getSymbol()),
                    given.getValue(), unit, position));
            case ADD_EQUATION:
                AddEquationCommand eq = (AddEquationCommand) command;
                return insert(NodeFactory.equation(eq.getLatex(), CommandSanitizer.sanitizeSymbol(eq.getLhs()),
                    ExpressionNormalizer.normalize(eq.getRhs()), position));
            case ADD_CONSTRAINT:
                AddConstraintCommand constraint = (AddConstraintCommand) command;
                ConstraintNode constraintNode = NodeFactory.constraint(constraint.getLatex(),
                    ExpressionNormalizer.normalize(constraint.getSympy()), position);
                if (constraint.getAppliesTo() != null) {
                    constraintNode.setAppliesTo(constraint.getAppliesTo());
                }
                return insert(constraintNode);
            case ADD_SOLVE_GOAL:
                AddSolveGoalCommand goal = (AddSolveGoalCommand) command;
                return insert(NodeFactory.solveGoal(CommandSanitizer.sanitizeSymbol(goal.getTarget()),
                    goal.getMethod(), position));
            case ADD_TEXT:
                return insert(NodeFactory.text(((AddTextCommand) command).getContent(), position));
            case ADD_ANNOTATION:
                AddAnnotationCommand note = (AddAnnotationCommand) command;
                return insert(NodeFactory.annotation(note.getContent(), note.getTitle(), position));
            case UPDATE_NODE:
                UpdateNodeCommand update = (UpdateNodeCommand) command;
                document.updateNode(update.getNodeId(), update.getUpdates());
                return update.getNodeId();
            case DELETE_NODE:
                String deleted = ((NodeTargetCommand) command).getNodeId();
                document.deleteNode(deleted);
                return deleted;
            case ADD_ASSUMPTION:
                AddAssumptionCommand assumption = (AddAssumptionCommand) command;
                document.addAssumption(assumption.getStatement(), assumption.getFormalExpression(),
                    assumption.getScope());
                return null;
            case REMOVE_ASSUMPTION:
                document.removeAssumption(((RemoveAssumptionCommand) command).getAssumptionId());
                return null;
            case VERIFY_NODE:
                String verified = ((NodeTargetCommand) command).getNodeId();
                document.verifyNode(verified);
                return verified;
            case VERIFY_ALL:
                document.verifyAllNodes();
                return null;
            default:
                throw new IllegalStateException("Unhandled action: " + command.getAction());
        }
    }

    private String insert(WorksheetNode node) {
        node.setProvenance(Provenance.llm());
        document.insertNode(node);
        return node.getId();
    }

    private static String describe(Exception e) {
        String m = e.getMessage();
        return m == null || m.isBlank() ? e.getClass().getSimpleName() : m;
    }
}
