package com.calcsheet.models;

/**
 * A known input value, e.g. {@code m = 10 kg}.
 */
public class GivenNode extends WorksheetNode {
    private String symbol;
    private String latex;
    private ValueWithUnit value = new ValueWithUnit();
    private String description;

    public GivenNode() {
    }

    public GivenNode(String id, NodePosition position, String symbol, ValueWithUnit value) {
        super(id, position);
        this.symbol = symbol;
        this.value = value;
    }

    @Override
    public NodeType getType() {
        return NodeType.GIVEN;
    }

    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }

    public String getLatex() {
        return latex;
    }

    public void setLatex(String latex) {
        this.latex = latex;
    }

    public ValueWithUnit getValue() {
        return value;
    }

    public void setValue(ValueWithUnit value) {
        this.value = value;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
