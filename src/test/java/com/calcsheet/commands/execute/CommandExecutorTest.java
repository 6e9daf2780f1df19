package com.calcsheet.commands.execute;

import com.calcsheet.commands.AddAssumptionCommand;
import com.calcsheet.commands.AddConstraintCommand;
import com.calcsheet.commands.AddEquationCommand;
import com.calcsheet.commands.AddGivenCommand;
import com.calcsheet.commands.AddTextCommand;
import com.calcsheet.commands.BatchResult;
import com.calcsheet.commands.CommandResult;
import com.calcsheet.commands.DeleteNodeCommand;
import com.calcsheet.commands.RemoveAssumptionCommand;
import com.calcsheet.commands.UpdateNodeCommand;
import com.calcsheet.commands.VerifyNodeCommand;
import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.commands.placement.NodeBox;
import com.calcsheet.commands.placement.PlacementPlanner;
import com.calcsheet.compute.RecordingUnitChecker;
import com.calcsheet.document.InMemoryDocumentModel;
import com.calcsheet.document.SampleWorksheet;
import com.calcsheet.models.ConstraintNode;
import com.calcsheet.models.EquationNode;
import com.calcsheet.models.GivenNode;
import com.calcsheet.models.NodePosition;
import com.calcsheet.models.Provenance;
import com.calcsheet.models.VerificationStatus;
import com.calcsheet.models.WorksheetNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CommandExecutorTest {

    private RecordingUnitChecker checker;
    private InMemoryDocumentModel document;
    private CommandExecutor executor;

    @BeforeEach
    void setUp() {
        checker = new RecordingUnitChecker();
        document = SampleWorksheet.create(checker);
        executor = new CommandExecutor(document);
    }

    @Test
    void oneFailureDoesNotStopTheBatch() {
        List<WorksheetCommand> commands = List.of(
            new AddGivenCommand("g", 9.81, "m/s^2", null),
            new DeleteNodeCommand("does-not-exist"),
            new AddTextCommand("Gravity acts downward."));

        BatchResult result = executor.executeBatch(commands);

        assertEquals(3, result.getTotal());
        assertEquals(2, result.getSucceeded());
        assertEquals(1, result.getFailed());
        CommandResult failed = result.getResults().get(1);
        assertFalse(failed.isSuccess());
        assertEquals("Node does-not-exist not found in document", failed.getError());
        assertNotNull(document.getNode(result.getResults().get(2).getNodeId()));
    }

    @Test
    void createdNodesAreMarkedAsModelAuthored() {
        BatchResult result = executor.executeBatch(List.of(new AddGivenCommand("g", 9.81, "m/s^2", "gravity")));
        GivenNode node = (GivenNode) document.getNode(result.getResults().get(0).getNodeId());
        assertEquals(Provenance.Type.LLM, node.getProvenance().getType());
        assertEquals(VerificationStatus.State.UNVERIFIED, node.getVerification().getStatus());
    }

    @Test
    void markupIsCleanedBeforeInsert() {
        BatchResult result = executor.executeBatch(List.of(
            new AddGivenCommand("\\rho_{w}", 1000, "\\mathrm{kg/m^3}", null),
            new AddEquationCommand("F = \\frac{W}{g} a", "F", "\\frac{W}{g} a"),
            new AddConstraintCommand("m > 0", "m \\cdot 1 > 0", List.of("m"))));

        GivenNode given = (GivenNode) document.getNode(result.getResults().get(0).getNodeId());
        assertEquals("rho_w", given.getSymbol());
        assertEquals("kg/m^3", given.getValue().getUnit());

        EquationNode eq = (EquationNode) document.getNode(result.getResults().get(1).getNodeId());
        assertEquals("(W)/(g) a", eq.getRhs());

        ConstraintNode constraint = (ConstraintNode) document.getNode(result.getResults().get(2).getNodeId());
        assertEquals("m * 1 > 0", constraint.getSympy());
        assertEquals(List.of("m"), constraint.getAppliesTo());
    }

    @Test
    void usesTheGivenPositions() {
        NodePosition planned = new NodePosition(400, 1200);
        BatchResult result = executor.executeBatch(
            List.of(new AddTextCommand("note"), new VerifyNodeCommand(SampleWorksheet.MASS_ID)),
            Arrays.asList(planned, null));
        assertEquals(planned, document.getNode(result.getResults().get(0).getNodeId()).getPosition());
        assertTrue(result.getResults().get(1).isSuccess());
    }

    @Test
    void updateThenVerify() {
        BatchResult result = executor.executeBatch(List.of(
            new UpdateNodeCommand(SampleWorksheet.MASS_ID, Map.of("value", 12)),
            new VerifyNodeCommand(SampleWorksheet.MASS_ID)));

        assertEquals(2, result.getSucceeded());
        GivenNode mass = (GivenNode) document.getNode(SampleWorksheet.MASS_ID);
        assertEquals(12.0, mass.getValue().getValue());
        assertEquals("kg", mass.getValue().getUnit());
        assertEquals(List.of("12 * kg"), checker.getExpressions());
        assertEquals(VerificationStatus.State.VERIFIED, mass.getVerification().getStatus());
    }

    @Test
    void badUpdateValueIsReported() {
        BatchResult result = executor.executeBatch(List.of(
            new UpdateNodeCommand(SampleWorksheet.MASS_ID, Map.of("value", "twelve"))));
        assertEquals("Invalid value for value: twelve", result.getResults().get(0).getError());
    }

    @Test
    void rejectedUpdateLeavesNodeAndLinksUntouched() {
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put("lhs", "G");
        updates.put("rhs", 5);

        BatchResult result = executor.executeBatch(List.of(new UpdateNodeCommand(SampleWorksheet.EQUATION_ID, updates)));

        assertEquals("Invalid value for rhs: 5", result.getResults().get(0).getError());
        EquationNode eq = (EquationNode) document.getNode(SampleWorksheet.EQUATION_ID);
        assertEquals("F", eq.getLhs());
        assertEquals("m*a", eq.getRhs());
        assertEquals(List.of(SampleWorksheet.EQUATION_ID), document.getNode(SampleWorksheet.GOAL_ID).getDependencies());
    }

    @Test
    void acceptedUpdateRelinksDependents() {
        BatchResult result = executor.executeBatch(List.of(
            new UpdateNodeCommand(SampleWorksheet.EQUATION_ID, Map.of("lhs", "G", "latex", "G = m a"))));

        assertTrue(result.getResults().get(0).isSuccess());
        assertEquals("G", ((EquationNode) document.getNode(SampleWorksheet.EQUATION_ID)).getLhs());
        assertTrue(document.getNode(SampleWorksheet.GOAL_ID).getDependencies().isEmpty());
    }

    @Test
    void concurrentBatchesGetSeparatePositions() throws Exception {
        List<WorksheetCommand> left = List.of(
            new AddGivenCommand("g", 9.81, "m/s^2", null), new AddGivenCommand("h", 2, "m", null));
        List<WorksheetCommand> right = List.of(
            new AddGivenCommand("k", 300, "N/m", null), new AddGivenCommand("x", 0.1, "m", null));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<BatchResult> first = pool.submit(() -> executor.executeBatch(left));
            Future<BatchResult> second = pool.submit(() -> executor.executeBatch(right));
            assertEquals(2, first.get(5, TimeUnit.SECONDS).getSucceeded());
            assertEquals(2, second.get(5, TimeUnit.SECONDS).getSucceeded());
        } finally {
            pool.shutdownNow();
        }

        List<WorksheetNode> nodes = document.getNodes();
        assertEquals(10, nodes.size());
        for (int i = 6; i < nodes.size(); i++) {
            NodeBox box = PlacementPlanner.estimateNodeBox(nodes.get(i));
            for (int j = 0; j < nodes.size(); j++) {
                if (j != i) {
                    assertFalse(box.overlaps(PlacementPlanner.estimateNodeBox(nodes.get(j)),
                        PlacementPlanner.OVERLAP_MARGIN_X, PlacementPlanner.OVERLAP_MARGIN_Y),
                        nodes.get(i) + " overlaps " + nodes.get(j));
                }
            }
        }
    }

    @Test
    void assumptions() {
        BatchResult added = executor.executeBatch(List.of(
            new AddAssumptionCommand("Frictionless surface", "mu = 0", List.of("m"))));
        assertTrue(added.getResults().get(0).isSuccess());
        assertNull(added.getResults().get(0).getNodeId());
        assertEquals(1, document.getAssumptions().size());

        BatchResult removed = executor.executeBatch(List.of(new RemoveAssumptionCommand("missing")));
        assertEquals("Assumption missing not found", removed.getResults().get(0).getError());
    }

    @Test
    void sanitizer() {
        assertEquals("rho_w", CommandSanitizer.sanitizeSymbol("\\rho_{w}"));
        assertEquals("F_mag", CommandSanitizer.sanitizeSymbol("|F|"));
        assertEquals("", CommandSanitizer.sanitizeSymbol(null));
        assertEquals("kg", CommandSanitizer.sanitizeUnit("\\; \\text{kg}"));
        assertEquals("N*m", CommandSanitizer.sanitizeUnit("{N*m}"));
        assertNull(CommandSanitizer.sanitizeUnit(null));
    }
}
