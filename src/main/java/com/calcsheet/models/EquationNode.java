package com.calcsheet.models;

public class EquationNode extends WorksheetNode {
    private String latex;
    private String lhs;
    private String rhs;
    private String sympy; // canonical form, optional

    public EquationNode() {
    }

    public EquationNode(String id, NodePosition position, String latex, String lhs, String rhs) {
        super(id, position);
        this.latex = latex;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    @Override
    public NodeType getType() {
        return NodeType.EQUATION;
    }

    public String getLatex() {
        return latex;
    }

    public void setLatex(String latex) {
        this.latex = latex;
    }

    public String getLhs() {
        return lhs;
    }

    public void setLhs(String lhs) {
        this.lhs = lhs;
    }

    public String getRhs() {
        return rhs;
    }

    public void setRhs(String rhs) {
        this.rhs = rhs;
    }

    public String getSympy() {
        return sympy;
    }

    public void setSympy(String sympy) {
        this.sympy = sympy;
    }
}
