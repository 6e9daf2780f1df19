package com.calcsheet.commands;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One edit operation proposed by the model. Instances are created by the parser,
 * consumed once by validation and execution, then discarded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class WorksheetCommand {
    private String reasoning;

    public abstract CommandAction getAction();

    public String getReasoning() {
        return reasoning;
    }

    public void setReasoning(String reasoning) {
        this.reasoning = reasoning;
    }

    @Override
    public String toString() {
        return getAction().getWireName();
    }
}
