package com.calcsheet.models;

public class SolveGoalNode extends WorksheetNode {
    private String targetSymbol;
    private SolveMethod method;

    public SolveGoalNode() {
    }

    public SolveGoalNode(String id, NodePosition position, String targetSymbol, SolveMethod method) {
        super(id, position);
        this.targetSymbol = targetSymbol;
        this.method = method;
    }

    @Override
    public NodeType getType() {
        return NodeType.SOLVE_GOAL;
    }

    public String getTargetSymbol() {
        return targetSymbol;
    }

    public void setTargetSymbol(String targetSymbol) {
        this.targetSymbol = targetSymbol;
    }

    public SolveMethod getMethod() {
        return method;
    }

    public void setMethod(SolveMethod method) {
        this.method = method;
    }
}
