package com.calcsheet.compute;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnitCheckResult {
    private boolean consistent;
    private String inferredUnit;
    private String dimensionality;
    private String details;
    private String error;

    public UnitCheckResult() {
    }

    public UnitCheckResult(boolean consistent, String details, String error) {
        this.consistent = consistent;
        this.details = details;
        this.error = error;
    }

    public static UnitCheckResult consistent() {
        return new UnitCheckResult(true, null, null);
    }

    public static UnitCheckResult inconsistent(String error) {
        return new UnitCheckResult(false, null, error);
    }

    public boolean isConsistent() {
        return consistent;
    }

    public void setConsistent(boolean consistent) {
        this.consistent = consistent;
    }

    @JsonProperty("inferred_unit")
    public String getInferredUnit() {
        return inferredUnit;
    }

    @JsonProperty("inferred_unit")
    public void setInferredUnit(String inferredUnit) {
        this.inferredUnit = inferredUnit;
    }

    public String getDimensionality() {
        return dimensionality;
    }

    public void setDimensionality(String dimensionality) {
        this.dimensionality = dimensionality;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    /**
     * Error text if any, otherwise details, otherwise empty.
     */
    public String describe() {
        if (error != null && !error.isBlank()) {
            return error;
        }
        return details != null ? details : "";
    }
}
