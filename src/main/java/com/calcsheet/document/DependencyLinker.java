package com.calcsheet.document;

import com.calcsheet.math.EquationForms;
import com.calcsheet.math.VariableExtractor;
import com.calcsheet.models.ConstraintNode;
import com.calcsheet.models.EquationNode;
import com.calcsheet.models.GivenNode;
import com.calcsheet.models.Provenance;
import com.calcsheet.models.ResultNode;
import com.calcsheet.models.SolveGoalNode;
import com.calcsheet.models.WorksheetNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recomputes dependency edges from the symbols nodes define and use.
 *
 * <ul>
 *   <li>an equation depends on the nodes defining any variable it uses, except its own lhs</li>
 *   <li>a constraint depends on the nodes defining its variables</li>
 *   <li>a solve goal depends on equations that define or mention its target</li>
 *   <li>a result depends on its solve goal and on the nodes its computed provenance names</li>
 * </ul>
 */
final class DependencyLinker {

    private DependencyLinker() {
    }

    static void relink(List<WorksheetNode> nodes) {
        Map<String, Set<String>> definers = new LinkedHashMap<>();
        Map<String, List<String>> equationVariables = new LinkedHashMap<>();
        Map<String, String> equationLhs = new LinkedHashMap<>();
        Set<String> ids = new HashSet<>();

        for (WorksheetNode node : nodes) {
            ids.add(node.getId());
            switch (node.getType()) {
                case GIVEN:
                    define(definers, ((GivenNode) node).getSymbol(), node.getId());
                    break;
                case RESULT:
                    define(definers, ((ResultNode) node).getSymbol(), node.getId());
                    break;
                case EQUATION:
                    EquationNode eq = (EquationNode) node;
                    String lhs = EquationForms.canonicalSides(eq.getLhs(), eq.getRhs(), eq.getLatex()).getLhs();
                    equationLhs.put(eq.getId(), lhs);
                    equationVariables.put(eq.getId(), VariableExtractor.extractVariables(
                        EquationForms.extractionExpression(eq.getLhs(), eq.getRhs(), eq.getLatex(), eq.getSympy())));
                    if (EquationForms.isIdentifier(lhs)) {
                        define(definers, lhs, eq.getId());
                    }
                    break;
                default:
                    break;
            }
        }

        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (WorksheetNode node : nodes) {
            Set<String> deps = new LinkedHashSet<>();
            switch (node.getType()) {
                case EQUATION:
                    String ownLhs = equationLhs.get(node.getId());
                    for (String variable : equationVariables.get(node.getId())) {
                        if (!variable.equals(ownLhs)) {
                            deps.addAll(definers.getOrDefault(variable, Set.of()));
                        }
                    }
                    break;
                case CONSTRAINT:
                    ConstraintNode constraint = (ConstraintNode) node;
                    String expr = constraint.getSympy() != null && !constraint.getSympy().isBlank()
                        ? constraint.getSympy() : constraint.getLatex();
                    for (String variable : VariableExtractor.extractVariables(expr)) {
                        deps.addAll(definers.getOrDefault(variable, Set.of()));
                    }
                    break;
                case SOLVE_GOAL:
                    String target = ((SolveGoalNode) node).getTargetSymbol();
                    for (Map.Entry<String, List<String>> entry : equationVariables.entrySet()) {
                        if (target != null && (target.equals(equationLhs.get(entry.getKey()))
                            || entry.getValue().contains(target))) {
                            deps.add(entry.getKey());
                        }
                    }
                    break;
                case RESULT:
                    ResultNode result = (ResultNode) node;
                    if (result.getSolveGoalId() != null) {
                        deps.add(result.getSolveGoalId());
                    }
                    Provenance provenance = result.getProvenance();
                    if (provenance != null && provenance.getType() == Provenance.Type.COMPUTED) {
                        deps.addAll(provenance.getFromNodes());
                    }
                    break;
                default:
                    break;
            }
            deps.remove(node.getId());
            deps.retainAll(ids);
            dependencies.put(node.getId(), deps);
        }

        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            for (String dep : entry.getValue()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(entry.getKey());
            }
        }
        for (WorksheetNode node : nodes) {
            node.setDependencies(new ArrayList<>(dependencies.get(node.getId())));
            node.setDependents(dependents.getOrDefault(node.getId(), List.of()));
        }
    }

    private static void define(Map<String, Set<String>> definers, String symbol, String nodeId) {
        if (symbol != null && !symbol.isBlank()) {
            definers.computeIfAbsent(symbol, k -> new LinkedHashSet<>()).add(nodeId);
        }
    }
}
