package com.calcsheet.commands;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class AddAssumptionCommand extends WorksheetCommand {
    private final String statement;
    private final String formalExpression;
    private final List<String> scope;

    public AddAssumptionCommand(String statement, String formalExpression, List<String> scope) {
        this.statement = statement;
        this.formalExpression = formalExpression;
        this.scope = scope != null ? new ArrayList<>(scope) : null;
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.ADD_ASSUMPTION;
    }

    public String getStatement() {
        return statement;
    }

    @JsonProperty("formal_expression")
    public String getFormalExpression() {
        return formalExpression;
    }

    public List<String> getScope() {
        return scope;
    }
}
