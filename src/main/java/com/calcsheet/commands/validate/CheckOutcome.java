package com.calcsheet.commands.validate;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one collaborator check (unit consistency, constraint satisfaction).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckOutcome {
    private final boolean passed;
    private final String message;

    public CheckOutcome(boolean passed, String message) {
        this.passed = passed;
        this.message = message;
    }

    public boolean isPassed() {
        return passed;
    }

    public String getMessage() {
        return message;
    }
}
