package com.calcsheet.models;

/**
 * A value produced by the solver for a solve goal.
 */
public class ResultNode extends WorksheetNode {
    private String symbol;
    private ValueWithUnit value = new ValueWithUnit();
    private String symbolicForm;
    private String solveGoalId;

    public ResultNode() {
    }

    public ResultNode(String id, NodePosition position, String symbol, ValueWithUnit value, String solveGoalId) {
        super(id, position);
        this.symbol = symbol;
        this.value = value;
        this.solveGoalId = solveGoalId;
    }

    @Override
    public NodeType getType() {
        return NodeType.RESULT;
    }

    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }

    public ValueWithUnit getValue() {
        return value;
    }

    public void setValue(ValueWithUnit value) {
        this.value = value;
    }

    public String getSymbolicForm() {
        return symbolicForm;
    }

    public void setSymbolicForm(String symbolicForm) {
        this.symbolicForm = symbolicForm;
    }

    public String getSolveGoalId() {
        return solveGoalId;
    }

    public void setSolveGoalId(String solveGoalId) {
        this.solveGoalId = solveGoalId;
    }
}
