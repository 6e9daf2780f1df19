package com.calcsheet.commands.validate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verdict for one command. {@code details} carries the {@code unit_check} outcome of a failed unit check.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResult {
    public static final String UNIT_CHECK = "unit_check";

    private final ValidationStatus status;
    private final String message;
    private final Map<String, CheckOutcome> details;

    private ValidationResult(ValidationStatus status, String message, Map<String, CheckOutcome> details) {
        this.status = status;
        this.message = message;
        this.details = details;
    }

    public static ValidationResult valid() {
        return new ValidationResult(ValidationStatus.VALID, null, null);
    }

    public static ValidationResult warning(String message) {
        return new ValidationResult(ValidationStatus.WARNING, message, null);
    }

    public static ValidationResult invalid(String message) {
        return new ValidationResult(ValidationStatus.INVALID, message, null);
    }

    public static ValidationResult unchecked() {
        return new ValidationResult(ValidationStatus.UNCHECKED, null, null);
    }

    public static ValidationResult invalidUnit(String message, String unitCheckMessage) {
        Map<String, CheckOutcome> details = new LinkedHashMap<>();
        details.put(UNIT_CHECK, new CheckOutcome(false, unitCheckMessage));
        return new ValidationResult(ValidationStatus.INVALID, message, details);
    }

    public ValidationStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, CheckOutcome> getDetails() {
        return details;
    }

    @JsonIgnore
    public CheckOutcome getUnitCheck() {
        return details != null ? details.get(UNIT_CHECK) : null;
    }

    @JsonIgnore
    public boolean isInvalid() {
        return status == ValidationStatus.INVALID;
    }

    @JsonProperty("blocking")
    public boolean isBlocking() {
        return isInvalid();
    }

    @Override
    public String toString() {
        return message != null ? status.getWireName() + ": " + message : status.getWireName();
    }
}
