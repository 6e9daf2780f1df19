package com.calcsheet.commands.validate;

import com.calcsheet.AppLogger;
import com.calcsheet.commands.AddConstraintCommand;
import com.calcsheet.commands.AddEquationCommand;
import com.calcsheet.commands.AddGivenCommand;
import com.calcsheet.commands.AddSolveGoalCommand;
import com.calcsheet.commands.CommandAction;
import com.calcsheet.commands.NodeTargetCommand;
import com.calcsheet.commands.RemoveAssumptionCommand;
import com.calcsheet.commands.UpdateNodeCommand;
import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.commands.resolve.NodeReferenceResolver;
import com.calcsheet.compute.UnitCheckResult;
import com.calcsheet.compute.UnitChecker;
import com.calcsheet.document.DocumentModel;
import com.calcsheet.models.Assumption;
import com.calcsheet.models.EquationNode;
import com.calcsheet.models.GivenNode;
import com.calcsheet.models.ResultNode;
import com.calcsheet.models.WorksheetNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks each proposed command against the live document and the unit engine, then applies
 * the batch-level structural completeness policy. Any {@code invalid} verdict blocks the batch.
 */
public class CommandValidator {

    private final DocumentModel document;
    private final UnitChecker unitChecker;
    private final NodeReferenceResolver resolver;
    private final AppLogger logger;

    public CommandValidator(DocumentModel document, UnitChecker unitChecker) {
        this(document, unitChecker, new NodeReferenceResolver(document));
    }

    public CommandValidator(DocumentModel document, UnitChecker unitChecker, NodeReferenceResolver resolver) {
        this.document = document;
        this.unitChecker = unitChecker;
        this.resolver = resolver;
        this.logger = AppLogger.get();
    }

    /**
     * Resolves node references in place, then returns one verdict per command, in command order.
     */
    public List<ValidationResult> validateBatch(List<? extends WorksheetCommand> commands) {
        resolver.resolveAll(commands);

        List<ValidationResult> results = new ArrayList<>();
        for (WorksheetCommand command : commands) {
            ValidationResult result;
            try {
                result = validateOne(command);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = ValidationResult.invalid("Validation error: " + describe(e));
            } catch (Exception e) {
                logger.error("[CommandValidator] " + command.getAction().getWireName() + " failed: " + describe(e), e);
                result = ValidationResult.invalid("Validation error: " + describe(e));
            }
            logger.info("[CommandValidator] " + command.getAction().getWireName() + " -> " + result);
            results.add(result);
        }

        String violation = StructuralCompletenessPolicy.check(commands, document.getNodes());
        if (violation != null) {
            for (int i = 0; i < commands.size(); i++) {
                if (commands.get(i).getAction() == CommandAction.ADD_EQUATION && !results.get(i).isInvalid()) {
                    results.set(i, ValidationResult.invalid(violation));
                    logger.warn("[CommandValidator] Structural completeness: " + violation);
                    break;
                }
            }
        }
        return results;
    }

    public static boolean hasInvalidCommands(List<ValidationResult> results) {
        for (ValidationResult result : results) {
            if (result.isInvalid()) {
                return true;
            }
        }
        return false;
    }

    ValidationResult validateOne(WorksheetCommand command) throws Exception {
        switch (command.getAction()) {
            case ADD_GIVEN:
                return validateGiven((AddGivenCommand) command);
            case ADD_EQUATION:
                AddEquationCommand eq = (AddEquationCommand) command;
                if (isBlank(eq.getLhs()) || isBlank(eq.getRhs())) {
                    return ValidationResult.invalid("Equation must have both left-hand and right-hand sides");
                }
                return ValidationResult.valid();
            case ADD_CONSTRAINT:
                if (isBlank(((AddConstraintCommand) command).getSympy())) {
                    return ValidationResult.invalid("Constraint must have a SymPy expression");
                }
                return ValidationResult.valid();
            case ADD_SOLVE_GOAL:
                if (isBlank(((AddSolveGoalCommand) command).getTarget())) {
                    return ValidationResult.invalid("Must specify a target symbol to solve for");
                }
                return ValidationResult.valid();
            case UPDATE_NODE:
                return validateUpdate((UpdateNodeCommand) command);
            case DELETE_NODE:
            case VERIFY_NODE:
                return requireNode((NodeTargetCommand) command);
            case REMOVE_ASSUMPTION:
                String assumptionId = ((RemoveAssumptionCommand) command).getAssumptionId();
                for (Assumption assumption : document.getAssumptions()) {
                    if (assumption.getId().equals(assumptionId)) {
                        return ValidationResult.valid();
                    }
                }
                return ValidationResult.invalid("Assumption " + assumptionId + " not found");
            case ADD_TEXT:
            case ADD_ANNOTATION:
            case ADD_ASSUMPTION:
            case VERIFY_ALL:
                return ValidationResult.valid();
            default:
                return ValidationResult.unchecked();
        }
    }

    private ValidationResult validateGiven(AddGivenCommand command) {
        if (!isEmpty(command.getUnit())) {
            UnitVerdict verdict = checkUnit(command.getUnit());
            if (!verdict.valid) {
                return ValidationResult.invalidUnit("Invalid unit: " + command.getUnit(), verdict.message);
            }
        }
        if (symbolExists(command.getSymbol())) {
            return ValidationResult.warning(
                "Symbol \"" + command.getSymbol() + "\" already exists and will create a duplicate");
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateUpdate(UpdateNodeCommand command) {
        ValidationResult missing = requireNode(command);
        if (missing.isInvalid()) {
            return missing;
        }
        Map<String, Object> updates = command.getUpdates();
        Object unit = updates.get("unit");
        if (unit instanceof String && !isEmpty((String) unit)) {
            UnitVerdict verdict = checkUnit((String) unit);
            if (!verdict.valid) {
                return ValidationResult.invalidUnit("Invalid unit in update: " + unit, verdict.message);
            }
        }
        Object value = updates.get("value");
        if (value instanceof Map) {
            Object nestedUnit = ((Map<?, ?>) value).get("unit");
            if (nestedUnit instanceof String && !isEmpty((String) nestedUnit)) {
                UnitVerdict verdict = checkUnit((String) nestedUnit);
                if (!verdict.valid) {
                    return ValidationResult.invalidUnit("Invalid unit in value update: " + nestedUnit, verdict.message);
                }
            }
        }
        return ValidationResult.valid();
    }

    private ValidationResult requireNode(NodeTargetCommand command) {
        if (document.getNode(command.getNodeId()) == null) {
            return ValidationResult.invalid("Node " + command.getNodeId() + " not found in document");
        }
        return ValidationResult.valid();
    }

    /**
     * A unit is checked as {@code 1 * <unit>}. A failing call counts as an invalid unit.
     */
    private UnitVerdict checkUnit(String unit) {
        try {
            UnitCheckResult result = unitChecker.checkUnits("1 * " + unit);
            if (result.isConsistent()) {
                return new UnitVerdict(true, null);
            }
            return new UnitVerdict(false, result.getDetails() != null ? result.getDetails() : result.getError());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new UnitVerdict(false, describe(e));
        } catch (Exception e) {
            logger.warn("[CommandValidator] Unit check for '" + unit + "' failed: " + describe(e));
            return new UnitVerdict(false, describe(e));
        }
    }

    private boolean symbolExists(String symbol) {
        for (WorksheetNode node : document.getNodes()) {
            switch (node.getType()) {
                case GIVEN:
                    if (symbol.equals(((GivenNode) node).getSymbol())) {
                        return true;
                    }
                    break;
                case RESULT:
                    if (symbol.equals(((ResultNode) node).getSymbol())) {
                        return true;
                    }
                    break;
                case EQUATION:
                    if (symbol.equals(((EquationNode) node).getLhs())) {
                        return true;
                    }
                    break;
                default:
                    break;
            }
        }
        return false;
    }

    private static String describe(Exception e) {
        String m = e.getMessage();
        return m == null || m.isBlank() ? e.getClass().getSimpleName() : m;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static final class UnitVerdict {
        private final boolean valid;
        private final String message;

        private UnitVerdict(boolean valid, String message) {
            this.valid = valid;
            this.message = message;
        }
    }
}
