package com.calcsheet.document;

public class AssumptionNotFoundException extends RuntimeException {
    private final String assumptionId;

    public AssumptionNotFoundException(String assumptionId) {
        super("Assumption " + assumptionId + " not found");
        this.assumptionId = assumptionId;
    }

    public String getAssumptionId() {
        return assumptionId;
    }
}
