package com.calcsheet.document;

import com.calcsheet.compute.RecordingUnitChecker;
import com.calcsheet.compute.UnitCheckResult;
import com.calcsheet.compute.UnitChecker;
import com.calcsheet.models.GivenNode;
import com.calcsheet.models.NodePosition;
import com.calcsheet.models.Provenance;
import com.calcsheet.models.ResultNode;
import com.calcsheet.models.ValueWithUnit;
import com.calcsheet.models.VerificationAuditEntry;
import com.calcsheet.models.VerificationStatus;
import com.calcsheet.models.WorksheetDocument;
import com.calcsheet.models.WorksheetNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.calcsheet.document.SampleWorksheet.*;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentModelTest {

    private RecordingUnitChecker checker;
    private InMemoryDocumentModel document;

    @BeforeEach
    void setUp() {
        checker = new RecordingUnitChecker();
        document = create(checker);
    }

    @Test
    void dependenciesFollowSymbols() {
        assertEquals(List.of(MASS_ID, ACCEL_ID), document.getNode(EQUATION_ID).getDependencies());
        assertEquals(List.of(EQUATION_ID), document.getNode(GOAL_ID).getDependencies());
        assertEquals(List.of(EQUATION_ID), document.getNode(MASS_ID).getDependents());
        assertTrue(document.getNode(TEXT_ID).getDependencies().isEmpty());
    }

    @Test
    void insertRelinks() {
        GivenNode g = NodeFactory.given("g", 9.81, "m/s^2", null);
        document.insertNode(g);
        document.updateNode(EQUATION_ID, Map.of("rhs", "m*g"));
        assertEquals(List.of(MASS_ID, g.getId()), document.getNode(EQUATION_ID).getDependencies());
        assertEquals(new NodePosition(NodeFactory.DEFAULT_X, NodeFactory.DEFAULT_Y), g.getPosition());
    }

    @Test
    void duplicateIdIsRejected() {
        GivenNode copy = new GivenNode(MASS_ID, new NodePosition(0, 0), "m2", new ValueWithUnit(1, "kg"));
        assertThrows(IllegalArgumentException.class, () -> document.insertNode(copy));
    }

    @Test
    void deletingAnInputMarksComputedResultsStale() {
        ResultNode result = new ResultNode("r-1", new NodePosition(100, 1040), "F", new ValueWithUnit(20, "N"), GOAL_ID);
        result.setProvenance(Provenance.computed(List.of(EQUATION_ID, MASS_ID)));
        document.insertNode(result);
        assertFalse(result.isStale());

        document.deleteNode(EQUATION_ID);

        assertTrue(result.isStale());
        assertNull(document.getNode(EQUATION_ID));
        assertEquals(List.of(GOAL_ID, MASS_ID), result.getDependencies());
    }

    @Test
    void missingNodes() {
        assertNull(document.getNode("nope"));
        NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> document.deleteNode("nope"));
        assertEquals("Node nope not found in document", e.getMessage());
        assertThrows(NodeNotFoundException.class, () -> document.updateNode("nope", Map.of()));
    }

    @Test
    void updatesAreTypeChecked() {
        document.updateNode(MASS_ID, Map.of("value", Map.of("value", 15, "unit", "g"), "not_a_field", 1));
        ValueWithUnit value = ((GivenNode) document.getNode(MASS_ID)).getValue();
        assertEquals(15.0, value.getValue());
        assertEquals("g", value.getUnit());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> document.updateNode(MASS_ID, Map.of("symbol", 5)));
        assertEquals("Invalid value for symbol: 5", e.getMessage());
    }

    @Test
    void verifyRecordsOutcomeAndAudit() throws Exception {
        checker.rejectUnit("m/s^2", "Unknown unit m/s^2");

        VerificationStatus accel = document.verifyNode(ACCEL_ID);
        VerificationStatus equation = document.verifyNode(EQUATION_ID);

        assertEquals(VerificationStatus.State.FAILED, accel.getStatus());
        assertEquals("Unknown unit", accel.getReason());
        assertEquals(VerificationStatus.State.VERIFIED, equation.getStatus());
        assertEquals(InMemoryDocumentModel.ENGINE_VERSION, equation.getEngineVersion());
        assertEquals(List.of("2 * m/s^2", "(F) - (m*a)"), checker.getExpressions());

        List<VerificationAuditEntry> audit = document.snapshot().getAuditTrail();
        assertEquals(2, audit.size());
        assertEquals(ACCEL_ID, audit.get(0).getNodeId());
        assertFalse(audit.get(0).isPassed());
    }

    @Test
    void nodesWithoutAnExpressionPassVerification() throws Exception {
        assertEquals(VerificationStatus.State.VERIFIED, document.verifyNode(TEXT_ID).getStatus());
        assertTrue(checker.getExpressions().isEmpty());
    }

    @Test
    void verifyAllChecksGivensAndEquations() throws Exception {
        assertEquals(3, document.verifyAllNodes().size());
    }

    @Test
    void readsAreNotBlockedWhileAUnitCheckIsInFlight() throws Exception {
        CountDownLatch checkStarted = new CountDownLatch(1);
        CountDownLatch releaseCheck = new CountDownLatch(1);
        UnitChecker slowChecker = (expression, expectedUnit) -> {
            checkStarted.countDown();
            releaseCheck.await(5, TimeUnit.SECONDS);
            return UnitCheckResult.consistent();
        };
        InMemoryDocumentModel sample = create(new RecordingUnitChecker());
        InMemoryDocumentModel model = new InMemoryDocumentModel(sample.snapshot(), slowChecker);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<VerificationStatus> verification = pool.submit(() -> model.verifyNode(MASS_ID));
            assertTrue(checkStarted.await(5, TimeUnit.SECONDS));

            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                assertEquals(6, model.getNodes().size());
                assertNotNull(model.snapshot());
            });

            releaseCheck.countDown();
            assertEquals(VerificationStatus.State.VERIFIED, verification.get(5, TimeUnit.SECONDS).getStatus());
            assertEquals(VerificationStatus.State.VERIFIED, model.getNode(MASS_ID).getVerification().getStatus());
        } finally {
            releaseCheck.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void assumptionsLifecycle() {
        String id = document.addAssumption("Rigid body", null, List.of("m")).getId();
        assertEquals(1, document.getAssumptions().size());
        document.removeAssumption(id);
        assertTrue(document.getAssumptions().isEmpty());
        assertThrows(AssumptionNotFoundException.class, () -> document.removeAssumption(id));
    }

    @Test
    void duplicateSymbolsAreReported() {
        assertTrue(document.findDuplicateSymbols().isEmpty());
        document.insertNode(NodeFactory.given("m", 12, "kg", null));
        assertEquals(List.of("m"), document.findDuplicateSymbols());
    }

    @Test
    void snapshotIsDetached() {
        WorksheetDocument snapshot = document.snapshot();
        snapshot.getNodes().clear();
        assertEquals(6, document.getNodes().size());
    }

    @Test
    void snapshotSerializesWithNodeTypes() throws Exception {
        String json = new ObjectMapper().writeValueAsString(document.snapshot());
        assertTrue(json.contains("\"type\":\"solve_goal\""), json);
        assertTrue(json.contains("\"type\":\"given\""), json);
    }

    @Test
    void readOnlyViews() {
        List<WorksheetNode> nodes = document.getNodes();
        assertThrows(UnsupportedOperationException.class, () -> nodes.add(null));
    }
}
