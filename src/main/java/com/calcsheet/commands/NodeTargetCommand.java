package com.calcsheet.commands;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A command addressed at an existing node. The reference resolver rewrites {@code nodeId} in place.
 */
public abstract class NodeTargetCommand extends WorksheetCommand {
    private String nodeId;

    protected NodeTargetCommand(String nodeId) {
        this.nodeId = nodeId;
    }

    @JsonProperty("node_id")
    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    @Override
    public String toString() {
        return getAction().getWireName() + "(" + nodeId + ")";
    }
}
