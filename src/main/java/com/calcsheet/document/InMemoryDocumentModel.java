package com.calcsheet.document;

import com.calcsheet.AppLogger;
import com.calcsheet.compute.UnitCheckResult;
import com.calcsheet.compute.UnitChecker;
import com.calcsheet.models.Assumption;
import com.calcsheet.models.EquationNode;
import com.calcsheet.models.GivenNode;
import com.calcsheet.models.NodeType;
import com.calcsheet.models.Provenance;
import com.calcsheet.models.ValueWithUnit;
import com.calcsheet.models.VerificationAuditEntry;
import com.calcsheet.models.VerificationStatus;
import com.calcsheet.models.WorksheetDocument;
import com.calcsheet.models.WorksheetNode;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single in-memory worksheet. Dependency edges are recomputed after every node mutation.
 */
public class InMemoryDocumentModel implements DocumentModel {

    public static final String ENGINE_VERSION = "compute-sidecar/unit-check";

    private final WorksheetDocument document;
    private final UnitChecker unitChecker;
    private final AppLogger logger;

    public InMemoryDocumentModel(UnitChecker unitChecker) {
        this(new WorksheetDocument(UUID.randomUUID().toString(), "Untitled worksheet"), unitChecker);
    }

    public InMemoryDocumentModel(WorksheetDocument document, UnitChecker unitChecker) {
        this.document = document;
        this.unitChecker = unitChecker;
        this.logger = AppLogger.get();
        DependencyLinker.relink(document.getNodes());
    }

    @Override
    public synchronized List<WorksheetNode> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(document.getNodes()));
    }

    @Override
    public synchronized List<Assumption> getAssumptions() {
        return Collections.unmodifiableList(new ArrayList<>(document.getAssumptions()));
    }

    @Override
    public synchronized WorksheetNode getNode(String id) {
        if (id == null) {
            return null;
        }
        for (WorksheetNode node : document.getNodes()) {
            if (id.equals(node.getId())) {
                return node;
            }
        }
        return null;
    }

    @Override
    public synchronized WorksheetDocument snapshot() {
        WorksheetDocument copy = new WorksheetDocument(document.getId(), document.getName());
        copy.setNodes(document.getNodes());
        copy.setAssumptions(document.getAssumptions());
        copy.setAuditTrail(document.getAuditTrail());
        return copy;
    }

    @Override
    public synchronized void insertNode(WorksheetNode node) {
        if (node == null || node.getId() == null) {
            throw new IllegalArgumentException("Node and node id are required");
        }
        if (getNode(node.getId()) != null) {
            throw new IllegalArgumentException("Node " + node.getId() + " already exists");
        }
        document.getNodes().add(node);
        DependencyLinker.relink(document.getNodes());
        logger.info("[Document] Inserted " + node);
    }

    @Override
    public synchronized void updateNode(String id, Map<String, Object> updates) {
        WorksheetNode node = requireNode(id);
        try {
            NodeUpdater.apply(node, updates != null ? updates : Map.of());
        } finally {
            DependencyLinker.relink(document.getNodes());
        }
        logger.info("[Document] Updated " + node + " fields " + (updates != null ? updates.keySet() : List.of()));
    }

    @Override
    public synchronized void deleteNode(String id) {
        WorksheetNode node = requireNode(id);
        document.getNodes().remove(node);
        int stale = 0;
        for (WorksheetNode other : document.getNodes()) {
            Provenance provenance = other.getProvenance();
            if (provenance != null && provenance.getType() == Provenance.Type.COMPUTED
                && provenance.getFromNodes().contains(id)) {
                other.setStale(true);
                stale++;
            }
        }
        DependencyLinker.relink(document.getNodes());
        logger.info("[Document] Deleted " + node + (stale > 0 ? " (" + stale + " computed node(s) marked stale)" : ""));
    }

    @Override
    public synchronized Assumption addAssumption(String statement, String formalExpression, List<String> scope) {
        Assumption assumption = new Assumption(UUID.randomUUID().toString(), statement, formalExpression, scope);
        document.getAssumptions().add(assumption);
        logger.info("[Document] Added assumption " + assumption.getId() + ": " + statement);
        return assumption;
    }

    @Override
    public synchronized void removeAssumption(String id) {
        boolean removed = id != null && document.getAssumptions().removeIf(a -> id.equals(a.getId()));
        if (!removed) {
            throw new AssumptionNotFoundException(id);
        }
        logger.info("[Document] Removed assumption " + id);
    }

    /**
     * Equations are checked as {@code (lhs) - (rhs)}, givens with a unit as {@code value * unit}.
     * Other node types pass without a check. The unit check runs without holding the document lock.
     */
    @Override
    public VerificationStatus verifyNode(String id) throws IOException, InterruptedException {
        String expression;
        synchronized (this) {
            expression = verificationExpression(requireNode(id));
        }

        boolean passed = true;
        String details = "";
        if (expression != null) {
            UnitCheckResult result = unitChecker.checkUnits(expression);
            passed = result.isConsistent();
            details = result.describe();
        }

        VerificationStatus status = passed
            ? VerificationStatus.verified(ENGINE_VERSION)
            : VerificationStatus.failed(details);
        synchronized (this) {
            WorksheetNode node = requireNode(id);
            node.setVerification(status);
            document.getAuditTrail().add(new VerificationAuditEntry(UUID.randomUUID().toString(), id,
                Instant.now().toString(), ENGINE_VERSION, passed, details));
            logger.info("[Document] Verified " + node + ": " + (passed ? "passed" : "failed " + details));
        }
        return status;
    }

    @Override
    public List<VerificationStatus> verifyAllNodes() throws IOException, InterruptedException {
        List<String> ids = new ArrayList<>();
        synchronized (this) {
            for (WorksheetNode node : document.getNodes()) {
                if (node.getType() == NodeType.EQUATION || node.getType() == NodeType.GIVEN) {
                    ids.add(node.getId());
                }
            }
        }
        List<VerificationStatus> results = new ArrayList<>();
        for (String id : ids) {
            results.add(verifyNode(id));
        }
        return results;
    }

    /**
     * Given symbols that more than one node defines. Duplicates are tolerated, never rejected.
     */
    public synchronized List<String> findDuplicateSymbols() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (WorksheetNode node : document.getNodes()) {
            if (node.getType() == NodeType.GIVEN) {
                String symbol = ((GivenNode) node).getSymbol();
                if (symbol != null && !symbol.isBlank()) {
                    counts.merge(symbol, 1, Integer::sum);
                }
            }
        }
        List<String> duplicates = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > 1) {
                duplicates.add(entry.getKey());
            }
        }
        return duplicates;
    }

    private String verificationExpression(WorksheetNode node) {
        if (node.getType() == NodeType.EQUATION) {
            EquationNode eq = (EquationNode) node;
            return "(" + eq.getLhs() + ") - (" + eq.getRhs() + ")";
        }
        if (node.getType() == NodeType.GIVEN) {
            ValueWithUnit value = ((GivenNode) node).getValue();
            if (value != null && value.hasUnit()) {
                return ValueWithUnit.formatNumber(value.getValue()) + " * " + value.getUnit();
            }
        }
        return null;
    }

    private WorksheetNode requireNode(String id) {
        WorksheetNode node = getNode(id);
        if (node == null) {
            throw new NodeNotFoundException(id);
        }
        return node;
    }
}
