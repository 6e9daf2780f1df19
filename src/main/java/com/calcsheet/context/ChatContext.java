package com.calcsheet.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Token-efficient worksheet summary sent along with a chat request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatContext {

    /**
     * Known value of a symbol and the node defining it.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SymbolEntry {
        private final double value;
        private final String unit;
        private final String nodeId;

        public SymbolEntry(double value, String unit, String nodeId) {
            this.value = value;
            this.unit = unit;
            this.nodeId = nodeId;
        }

        public double getValue() {
            return value;
        }

        public String getUnit() {
            return unit;
        }

        @JsonProperty("node_id")
        public String getNodeId() {
            return nodeId;
        }
    }

    private final Map<String, SymbolEntry> symbols;
    private final List<String> equations;
    private final List<String> assumptions;
    private final List<NodeRef> nodeRefs;
    private final String focusNodeId;
    private final String query;
    private final String instructions;

    public ChatContext(Map<String, SymbolEntry> symbols, List<String> equations, List<String> assumptions,
                       List<NodeRef> nodeRefs, String focusNodeId, String query, String instructions) {
        this.symbols = symbols;
        this.equations = equations;
        this.assumptions = assumptions;
        this.nodeRefs = nodeRefs;
        this.focusNodeId = focusNodeId;
        this.query = query;
        this.instructions = instructions;
    }

    public Map<String, SymbolEntry> getSymbols() {
        return symbols;
    }

    public List<String> getEquations() {
        return equations;
    }

    public List<String> getAssumptions() {
        return assumptions;
    }

    @JsonProperty("node_refs")
    public List<NodeRef> getNodeRefs() {
        return nodeRefs;
    }

    @JsonProperty("focus_node_id")
    public String getFocusNodeId() {
        return focusNodeId;
    }

    public String getQuery() {
        return query;
    }

    public String getInstructions() {
        return instructions;
    }
}
