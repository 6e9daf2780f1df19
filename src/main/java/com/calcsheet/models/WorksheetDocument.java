package com.calcsheet.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered nodes plus the assumption ledger. Node order is document order.
 */
public class WorksheetDocument {
    private String id;
    private String name;
    private List<WorksheetNode> nodes = new ArrayList<>();
    private List<Assumption> assumptions = new ArrayList<>();
    private List<VerificationAuditEntry> auditTrail = new ArrayList<>();

    public WorksheetDocument() {
    }

    public WorksheetDocument(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<WorksheetNode> getNodes() {
        return nodes;
    }

    public void setNodes(List<WorksheetNode> nodes) {
        this.nodes = nodes != null ? new ArrayList<>(nodes) : new ArrayList<>();
    }

    public List<Assumption> getAssumptions() {
        return assumptions;
    }

    public void setAssumptions(List<Assumption> assumptions) {
        this.assumptions = assumptions != null ? new ArrayList<>(assumptions) : new ArrayList<>();
    }

    public List<VerificationAuditEntry> getAuditTrail() {
        return auditTrail;
    }

    public void setAuditTrail(List<VerificationAuditEntry> auditTrail) {
        this.auditTrail = auditTrail != null ? new ArrayList<>(auditTrail) : new ArrayList<>();
    }
}
