package com.calcsheet.models;

/**
 * One verification run recorded against a node.
 */
public class VerificationAuditEntry {
    private String id;
    private String nodeId;
    private String timestamp;
    private String engineVersion;
    private boolean passed;
    private String details;

    public VerificationAuditEntry() {
    }

    public VerificationAuditEntry(String id, String nodeId, String timestamp, String engineVersion,
                                  boolean passed, String details) {
        this.id = id;
        this.nodeId = nodeId;
        this.timestamp = timestamp;
        this.engineVersion = engineVersion;
        this.passed = passed;
        this.details = details;
    }

    public String getId() {
        return id;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getEngineVersion() {
        return engineVersion;
    }

    public boolean isPassed() {
        return passed;
    }

    public String getDetails() {
        return details;
    }
}
