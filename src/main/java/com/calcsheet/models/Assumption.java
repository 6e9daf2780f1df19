package com.calcsheet.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry of the assumption ledger, e.g. "steady state" scoped to a set of nodes.
 */
public class Assumption {
    private String id;
    private String statement;
    private String formalExpression;
    private List<String> scope = new ArrayList<>();
    private boolean active = true;
    private Provenance provenance = Provenance.user();

    public Assumption() {
    }

    public Assumption(String id, String statement, String formalExpression, List<String> scope) {
        this.id = id;
        this.statement = statement;
        this.formalExpression = formalExpression;
        setScope(scope);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getStatement() {
        return statement;
    }

    public void setStatement(String statement) {
        this.statement = statement;
    }

    public String getFormalExpression() {
        return formalExpression;
    }

    public void setFormalExpression(String formalExpression) {
        this.formalExpression = formalExpression;
    }

    public List<String> getScope() {
        return scope;
    }

    public void setScope(List<String> scope) {
        this.scope = scope != null ? new ArrayList<>(scope) : new ArrayList<>();
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public void setProvenance(Provenance provenance) {
        this.provenance = provenance;
    }
}
