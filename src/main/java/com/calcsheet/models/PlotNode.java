package com.calcsheet.models;

import java.util.ArrayList;
import java.util.List;

public class PlotNode extends WorksheetNode {
    private List<String> expressions = new ArrayList<>();
    private String variable = "x";
    private double xMin = -10;
    private double xMax = 10;

    public PlotNode() {
    }

    public PlotNode(String id, NodePosition position, List<String> expressions, String variable) {
        super(id, position);
        setExpressions(expressions);
        this.variable = variable;
    }

    @Override
    public NodeType getType() {
        return NodeType.PLOT;
    }

    public List<String> getExpressions() {
        return expressions;
    }

    public void setExpressions(List<String> expressions) {
        this.expressions = expressions != null ? new ArrayList<>(expressions) : new ArrayList<>();
    }

    public String getVariable() {
        return variable;
    }

    public void setVariable(String variable) {
        this.variable = variable;
    }

    public double getXMin() {
        return xMin;
    }

    public void setXMin(double xMin) {
        this.xMin = xMin;
    }

    public double getXMax() {
        return xMax;
    }

    public void setXMax(double xMax) {
        this.xMax = xMax;
    }
}
