package com.calcsheet.document;

import com.calcsheet.models.AnnotationNode;
import com.calcsheet.models.ConstraintNode;
import com.calcsheet.models.EquationNode;
import com.calcsheet.models.GivenNode;
import com.calcsheet.models.NodePosition;
import com.calcsheet.models.SolveGoalNode;
import com.calcsheet.models.SolveMethod;
import com.calcsheet.models.TextNode;
import com.calcsheet.models.ValueWithUnit;

import java.util.UUID;

/**
 * Creates nodes with a fresh id, user provenance and unverified status.
 * A null position places the node at the default canvas origin.
 */
public final class NodeFactory {

    public static final double DEFAULT_X = 100;
    public static final double DEFAULT_Y = 100;

    private NodeFactory() {
    }

    public static GivenNode given(String symbol, double value, String unit, NodePosition position) {
        String normalizedUnit = unit != null && !unit.isBlank() ? unit : null;
        return new GivenNode(newId(), orDefault(position), symbol, new ValueWithUnit(value, normalizedUnit));
    }

    public static EquationNode equation(String latex, String lhs, String rhs, NodePosition position) {
        return new EquationNode(newId(), orDefault(position), latex, lhs, rhs);
    }

    public static ConstraintNode constraint(String latex, String sympy, NodePosition position) {
        return new ConstraintNode(newId(), orDefault(position), latex, sympy);
    }

    public static SolveGoalNode solveGoal(String targetSymbol, SolveMethod method, NodePosition position) {
        return new SolveGoalNode(newId(), orDefault(position), targetSymbol, method);
    }

    public static TextNode text(String content, NodePosition position) {
        return new TextNode(newId(), orDefault(position), content);
    }

    public static AnnotationNode annotation(String content, String title, NodePosition position) {
        return new AnnotationNode(newId(), orDefault(position), content, title);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static NodePosition orDefault(NodePosition position) {
        return position != null ? position.copy() : new NodePosition(DEFAULT_X, DEFAULT_Y);
    }
}
