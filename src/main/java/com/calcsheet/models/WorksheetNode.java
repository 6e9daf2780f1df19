package com.calcsheet.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Common state of every worksheet node. Subclasses add the type-specific payload.
 */
public abstract class WorksheetNode {
    private String id;
    private NodePosition position;
    private List<String> dependencies = new ArrayList<>();
    private List<String> dependents = new ArrayList<>();
    private List<String> assumptions = new ArrayList<>();
    private Provenance provenance = Provenance.user();
    private VerificationStatus verification = VerificationStatus.unverified();
    private boolean stale;

    protected WorksheetNode() {
    }

    protected WorksheetNode(String id, NodePosition position) {
        this.id = id;
        this.position = position;
    }

    public abstract NodeType getType();

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public NodePosition getPosition() {
        return position;
    }

    public void setPosition(NodePosition position) {
        this.position = position;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>();
    }

    public List<String> getDependents() {
        return dependents;
    }

    public void setDependents(List<String> dependents) {
        this.dependents = dependents != null ? new ArrayList<>(dependents) : new ArrayList<>();
    }

    public List<String> getAssumptions() {
        return assumptions;
    }

    public void setAssumptions(List<String> assumptions) {
        this.assumptions = assumptions != null ? new ArrayList<>(assumptions) : new ArrayList<>();
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public void setProvenance(Provenance provenance) {
        this.provenance = provenance;
    }

    public VerificationStatus getVerification() {
        return verification;
    }

    public void setVerification(VerificationStatus verification) {
        this.verification = verification;
    }

    public boolean isStale() {
        return stale;
    }

    public void setStale(boolean stale) {
        this.stale = stale;
    }

    @Override
    public String toString() {
        return getType().getWireName() + "{" + id + "}";
    }
}
