package com.calcsheet.document;

public class NodeNotFoundException extends RuntimeException {
    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Node " + nodeId + " not found in document");
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
