package com.calcsheet.commands.validate;

import com.calcsheet.commands.AddAnnotationCommand;
import com.calcsheet.commands.AddConstraintCommand;
import com.calcsheet.commands.AddEquationCommand;
import com.calcsheet.commands.AddGivenCommand;
import com.calcsheet.commands.AddSolveGoalCommand;
import com.calcsheet.commands.AddTextCommand;
import com.calcsheet.commands.DeleteNodeCommand;
import com.calcsheet.commands.RemoveAssumptionCommand;
import com.calcsheet.commands.UpdateNodeCommand;
import com.calcsheet.commands.VerifyAllCommand;
import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.compute.RecordingUnitChecker;
import com.calcsheet.document.InMemoryDocumentModel;
import com.calcsheet.document.SampleWorksheet;
import com.calcsheet.models.Assumption;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandValidatorTest {

    private RecordingUnitChecker checker;
    private InMemoryDocumentModel document;
    private CommandValidator validator;

    @BeforeEach
    void setUp() {
        checker = new RecordingUnitChecker().rejectUnit("furlongz", "Unknown unit furlongz");
        document = SampleWorksheet.create(checker);
        validator = new CommandValidator(document, checker);
    }

    private ValidationResult validateSingle(WorksheetCommand command) {
        List<ValidationResult> results = validator.validateBatch(List.of(command));
        assertEquals(1, results.size());
        return results.get(0);
    }

    @Test
    void newGivenWithKnownUnitIsValid() {
        ValidationResult result = validateSingle(new AddGivenCommand("v", 3, "m/s", null));
        assertEquals(ValidationStatus.VALID, result.getStatus());
        assertEquals(List.of("1 * m/s"), checker.getExpressions());
    }

    @Test
    void unknownUnitBlocks() {
        ValidationResult result = validateSingle(new AddGivenCommand("L", 3, "furlongz", null));
        assertEquals(ValidationStatus.INVALID, result.getStatus());
        assertEquals("Invalid unit: furlongz", result.getMessage());
        assertFalse(result.getUnitCheck().isPassed());
        assertEquals("Unknown unit furlongz", result.getUnitCheck().getMessage());
        assertTrue(result.isBlocking());
    }

    @Test
    void givenWithoutUnitSkipsTheEngine() {
        assertEquals(ValidationStatus.VALID, validateSingle(new AddGivenCommand("n", 4, null, null)).getStatus());
        assertTrue(checker.getExpressions().isEmpty());
    }

    @Test
    void duplicateSymbolIsOnlyAWarning() {
        ValidationResult result = validateSingle(new AddGivenCommand("m", 12, "kg", null));
        assertEquals(ValidationStatus.WARNING, result.getStatus());
        assertEquals("Symbol \"m\" already exists and will create a duplicate", result.getMessage());
        assertFalse(result.isBlocking());
    }

    @Test
    void engineFailureCountsAsInvalidUnit() {
        checker.failWith(new IOException("connection refused"));
        ValidationResult result = validateSingle(new AddGivenCommand("v", 3, "m/s", null));
        assertEquals(ValidationStatus.INVALID, result.getStatus());
        assertEquals("connection refused", result.getUnitCheck().getMessage());
    }

    @Test
    void structuralFieldChecks() {
        assertEquals("Equation must have both left-hand and right-hand sides",
            validateSingle(new AddEquationCommand("F =", "F", " ")).getMessage());
        assertEquals("Constraint must have a SymPy expression",
            validateSingle(new AddConstraintCommand("m > 0", "", null)).getMessage());
        assertEquals("Must specify a target symbol to solve for",
            validateSingle(new AddSolveGoalCommand("", null)).getMessage());
        assertEquals(ValidationStatus.VALID, validateSingle(new VerifyAllCommand()).getStatus());
    }

    @Test
    void nodeTargetsAreResolvedBeforeChecking() {
        DeleteNodeCommand delete = new DeleteNodeCommand("m");
        assertEquals(ValidationStatus.VALID, validateSingle(delete).getStatus());
        assertEquals(SampleWorksheet.MASS_ID, delete.getNodeId());

        ValidationResult missing = validateSingle(new DeleteNodeCommand("'nope'"));
        assertEquals("Node nope not found in document", missing.getMessage());
    }

    @Test
    void updateUnitsAreChecked() {
        ValidationResult flat = validateSingle(new UpdateNodeCommand("m", Map.of("unit", "furlongz")));
        assertEquals("Invalid unit in update: furlongz", flat.getMessage());

        ValidationResult nested = validateSingle(new UpdateNodeCommand("m",
            Map.of("value", Map.of("value", 3, "unit", "furlongz"))));
        assertEquals("Invalid unit in value update: furlongz", nested.getMessage());

        assertEquals(ValidationStatus.VALID,
            validateSingle(new UpdateNodeCommand("m", Map.of("value", 11))).getStatus());
    }

    @Test
    void assumptionRemovalNeedsAnExistingAssumption() {
        Assumption assumption = document.addAssumption("Frictionless surface", null, null);
        assertEquals(ValidationStatus.VALID,
            validateSingle(new RemoveAssumptionCommand(assumption.getId())).getStatus());
        assertEquals("Assumption missing-1 not found",
            validateSingle(new RemoveAssumptionCommand("missing-1")).getMessage());
    }

    @Test
    void equationWithoutContextIsBlocked() {
        InMemoryDocumentModel empty = new InMemoryDocumentModel(checker);
        CommandValidator emptyValidator = new CommandValidator(empty, checker);
        List<ValidationResult> results = emptyValidator.validateBatch(List.of(
            new AddGivenCommand("m", 10, "kg", null),
            new AddEquationCommand("F = m a", "F", "m*a")));

        assertEquals(ValidationStatus.VALID, results.get(0).getStatus());
        assertEquals(ValidationStatus.INVALID, results.get(1).getStatus());
        assertEquals("Equation proposals must include a problem restatement (`add_text`) and a diagram "
            + "(`add_annotation`) with a fenced ASCII sketch (at least 3 lines).", results.get(1).getMessage());
        assertTrue(CommandValidator.hasInvalidCommands(results));
    }

    @Test
    void policyVerdictGoesToFirstEquationNotAlreadyInvalid() {
        CommandValidator emptyValidator = new CommandValidator(new InMemoryDocumentModel(checker), checker);
        List<ValidationResult> results = emptyValidator.validateBatch(List.of(
            new AddTextCommand("A block is pushed."),
            new AddEquationCommand("F =", "F", ""),
            new AddEquationCommand("F = m a", "F", "m*a")));

        assertEquals(ValidationStatus.VALID, results.get(0).getStatus());
        assertEquals("Equation must have both left-hand and right-hand sides", results.get(1).getMessage());
        assertTrue(results.get(2).getMessage().startsWith("Equation proposals must include a diagram"));
    }

    @Test
    void contextInTheSameBatchSatisfiesThePolicy() {
        CommandValidator emptyValidator = new CommandValidator(new InMemoryDocumentModel(checker), checker);
        List<ValidationResult> results = emptyValidator.validateBatch(List.of(
            new AddTextCommand("A 10 kg block accelerates at 2 m/s^2."),
            new AddAnnotationCommand(SampleWorksheet.SKETCH, "Free body diagram"),
            new AddEquationCommand("F = m a", "F", "m*a")));
        assertFalse(CommandValidator.hasInvalidCommands(results));
    }

    @Test
    void collaboratorErrorsBecomeInvalidVerdicts() {
        InMemoryDocumentModel broken = new InMemoryDocumentModel(checker) {
            @Override
            public synchronized List<Assumption> getAssumptions() {
                throw new IllegalStateException("store offline");
            }
        };
        List<ValidationResult> results = new CommandValidator(broken, checker)
            .validateBatch(List.of(new RemoveAssumptionCommand("a-1"), new VerifyAllCommand()));
        assertEquals("Validation error: store offline", results.get(0).getMessage());
        assertEquals(ValidationStatus.VALID, results.get(1).getStatus());
    }

    @Test
    void warningsDoNotBlock() {
        assertFalse(CommandValidator.hasInvalidCommands(List.of(ValidationResult.valid(),
            ValidationResult.warning("duplicate"), ValidationResult.unchecked())));
    }

    @Test
    void serializedVerdictCarriesUnitCheckDetails() throws Exception {
        String json = new ObjectMapper().writeValueAsString(
            ValidationResult.invalidUnit("Invalid unit: furlongz", "Unknown unit furlongz"));
        assertTrue(json.contains("\"status\":\"invalid\""), json);
        assertTrue(json.contains("\"unit_check\":{\"passed\":false,\"message\":\"Unknown unit furlongz\"}"), json);
        assertTrue(json.contains("\"blocking\":true"), json);
    }
}
