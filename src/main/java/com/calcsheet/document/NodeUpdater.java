package com.calcsheet.document;

import com.calcsheet.AppLogger;
import com.calcsheet.models.AnnotationNode;
import com.calcsheet.models.ConstraintNode;
import com.calcsheet.models.EquationNode;
import com.calcsheet.models.GivenNode;
import com.calcsheet.models.NodePosition;
import com.calcsheet.models.PlotNode;
import com.calcsheet.models.ResultNode;
import com.calcsheet.models.SolveGoalNode;
import com.calcsheet.models.SolveMethod;
import com.calcsheet.models.TextNode;
import com.calcsheet.models.ValueWithUnit;
import com.calcsheet.models.WorksheetNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies a decoded partial update to a node. Keys that do not apply to the node's type are
 * logged and skipped; a value of the wrong type raises {@link IllegalArgumentException}.
 * Every value is checked before the first field is written, so a rejected update leaves the node unchanged.
 */
final class NodeUpdater {

    private NodeUpdater() {
    }

    static void apply(WorksheetNode node, Map<String, Object> updates) {
        List<String> ignored = new ArrayList<>();
        List<Runnable> writes = new ArrayList<>();
        for (Map.Entry<String, Object> entry : updates.entrySet()) {
            Runnable write = stageField(node, entry.getKey(), entry.getValue());
            if (write == null) {
                ignored.add(entry.getKey());
            } else {
                writes.add(write);
            }
        }
        for (Runnable write : writes) {
            write.run();
        }
        if (!ignored.isEmpty()) {
            AppLogger.get().warn("[NodeUpdater] Ignored fields for " + node + ": " + ignored);
        }
    }

    private static Runnable stageField(WorksheetNode node, String key, Object value) {
        if ("position".equals(key)) {
            NodePosition position = asPosition(key, value);
            return () -> node.setPosition(position);
        }
        switch (node.getType()) {
            case GIVEN:
                return stageGiven((GivenNode) node, key, value);
            case RESULT:
                return stageResult((ResultNode) node, key, value);
            case EQUATION:
                return stageEquation((EquationNode) node, key, value);
            case CONSTRAINT:
                return stageConstraint((ConstraintNode) node, key, value);
            case SOLVE_GOAL:
                return stageSolveGoal((SolveGoalNode) node, key, value);
            case TEXT:
                if ("content".equals(key)) {
                    String content = asString(key, value);
                    return () -> ((TextNode) node).setContent(content);
                }
                return null;
            case ANNOTATION:
                return stageAnnotation((AnnotationNode) node, key, value);
            case PLOT:
                return stagePlot((PlotNode) node, key, value);
            default:
                return null;
        }
    }

    private static Runnable stageGiven(GivenNode node, String key, Object value) {
        switch (key) {
            case "symbol": {
                String symbol = asString(key, value);
                return () -> node.setSymbol(symbol);
            }
            case "latex": {
                String latex = asString(key, value);
                return () -> node.setLatex(latex);
            }
            case "description": {
                String description = asString(key, value);
                return () -> node.setDescription(description);
            }
            case "value": {
                ValuePatch patch = ValuePatch.of(value);
                return () -> node.setValue(patch.mergeInto(node.getValue()));
            }
            case "unit": {
                String unit = asString(key, value);
                return () -> node.setValue(new ValueWithUnit(currentValue(node.getValue()), unit));
            }
            default:
                return null;
        }
    }

    private static Runnable stageResult(ResultNode node, String key, Object value) {
        switch (key) {
            case "symbol": {
                String symbol = asString(key, value);
                return () -> node.setSymbol(symbol);
            }
            case "value": {
                ValuePatch patch = ValuePatch.of(value);
                return () -> node.setValue(patch.mergeInto(node.getValue()));
            }
            case "unit": {
                String unit = asString(key, value);
                return () -> node.setValue(new ValueWithUnit(currentValue(node.getValue()), unit));
            }
            case "symbolic_form": {
                String form = asString(key, value);
                return () -> node.setSymbolicForm(form);
            }
            default:
                return null;
        }
    }

    private static Runnable stageEquation(EquationNode node, String key, Object value) {
        switch (key) {
            case "latex": {
                String latex = asString(key, value);
                return () -> node.setLatex(latex);
            }
            case "lhs": {
                String lhs = asString(key, value);
                return () -> node.setLhs(lhs);
            }
            case "rhs": {
                String rhs = asString(key, value);
                return () -> node.setRhs(rhs);
            }
            case "sympy": {
                String sympy = asString(key, value);
                return () -> node.setSympy(sympy);
            }
            default:
                return null;
        }
    }

    private static Runnable stageConstraint(ConstraintNode node, String key, Object value) {
        switch (key) {
            case "latex": {
                String latex = asString(key, value);
                return () -> node.setLatex(latex);
            }
            case "sympy": {
                String sympy = asString(key, value);
                return () -> node.setSympy(sympy);
            }
            case "description": {
                String description = asString(key, value);
                return () -> node.setDescription(description);
            }
            case "applies_to": {
                List<String> appliesTo = asStringList(key, value);
                return () -> node.setAppliesTo(appliesTo);
            }
            default:
                return null;
        }
    }

    private static Runnable stageSolveGoal(SolveGoalNode node, String key, Object value) {
        switch (key) {
            case "target":
            case "target_symbol": {
                String target = asString(key, value);
                return () -> node.setTargetSymbol(target);
            }
            case "method": {
                SolveMethod method = SolveMethod.fromWire(asString(key, value));
                if (method == null) {
                    throw new IllegalArgumentException("Invalid value for method: " + value);
                }
                return () -> node.setMethod(method);
            }
            default:
                return null;
        }
    }

    private static Runnable stageAnnotation(AnnotationNode node, String key, Object value) {
        switch (key) {
            case "content": {
                String content = asString(key, value);
                return () -> node.setContent(content);
            }
            case "title": {
                String title = asString(key, value);
                return () -> node.setTitle(title);
            }
            case "collapsed": {
                if (!(value instanceof Boolean)) {
                    throw new IllegalArgumentException("Invalid value for collapsed: " + value);
                }
                boolean collapsed = (Boolean) value;
                return () -> node.setCollapsed(collapsed);
            }
            default:
                return null;
        }
    }

    private static Runnable stagePlot(PlotNode node, String key, Object value) {
        switch (key) {
            case "expressions": {
                List<String> expressions = asStringList(key, value);
                return () -> node.setExpressions(expressions);
            }
            case "variable": {
                String variable = asString(key, value);
                return () -> node.setVariable(variable);
            }
            case "x_min": {
                double xMin = asNumber(key, value);
                return () -> node.setXMin(xMin);
            }
            case "x_max": {
                double xMax = asNumber(key, value);
                return () -> node.setXMax(xMax);
            }
            default:
                return null;
        }
    }

    /**
     * Checked form of a {@code value} update: a bare number or an object carrying {@code value} and/or {@code unit}.
     */
    private static final class ValuePatch {
        private final Double number;
        private final boolean replacesUnit;
        private final String unit;

        private ValuePatch(Double number, boolean replacesUnit, String unit) {
            this.number = number;
            this.replacesUnit = replacesUnit;
            this.unit = unit;
        }

        static ValuePatch of(Object value) {
            if (value instanceof Number) {
                return new ValuePatch(((Number) value).doubleValue(), false, null);
            }
            if (value instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) value;
                Double number = map.containsKey("value") ? asNumber("value", map.get("value")) : null;
                boolean replacesUnit = map.containsKey("unit");
                Object rawUnit = map.get("unit");
                String unit = rawUnit == null ? null : asString("unit", rawUnit);
                return new ValuePatch(number, replacesUnit, unit);
            }
            throw new IllegalArgumentException("Invalid value for value: " + value);
        }

        ValueWithUnit mergeInto(ValueWithUnit current) {
            double merged = number != null ? number : currentValue(current);
            String mergedUnit = replacesUnit ? unit : (current != null ? current.getUnit() : null);
            return new ValueWithUnit(merged, mergedUnit);
        }
    }

    private static double currentValue(ValueWithUnit value) {
        return value != null ? value.getValue() : 0;
    }

    private static String asString(String key, Object value) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }

    private static double asNumber(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }

    private static List<String> asStringList(String key, Object value) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
        }
        List<String> items = new ArrayList<>();
        for (Object item : (List<?>) value) {
            items.add(asString(key, item));
        }
        return items;
    }

    private static NodePosition asPosition(String key, Object value) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
        }
        Map<?, ?> map = (Map<?, ?>) value;
        return new NodePosition(asNumber("position.x", map.get("x")), asNumber("position.y", map.get("y")));
    }
}
