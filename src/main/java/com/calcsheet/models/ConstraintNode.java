package com.calcsheet.models;

import java.util.ArrayList;
import java.util.List;

public class ConstraintNode extends WorksheetNode {
    private String latex;
    private String sympy;
    private String description;
    private List<String> appliesTo = new ArrayList<>();

    public ConstraintNode() {
    }

    public ConstraintNode(String id, NodePosition position, String latex, String sympy) {
        super(id, position);
        this.latex = latex;
        this.sympy = sympy;
    }

    @Override
    public NodeType getType() {
        return NodeType.CONSTRAINT;
    }

    public String getLatex() {
        return latex;
    }

    public void setLatex(String latex) {
        this.latex = latex;
    }

    public String getSympy() {
        return sympy;
    }

    public void setSympy(String sympy) {
        this.sympy = sympy;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getAppliesTo() {
        return appliesTo;
    }

    public void setAppliesTo(List<String> appliesTo) {
        this.appliesTo = appliesTo != null ? new ArrayList<>(appliesTo) : new ArrayList<>();
    }
}
