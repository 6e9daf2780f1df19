package com.calcsheet.commands;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class AddConstraintCommand extends WorksheetCommand {
    private final String latex;
    private final String sympy;
    private final List<String> appliesTo;

    public AddConstraintCommand(String latex, String sympy, List<String> appliesTo) {
        this.latex = latex;
        this.sympy = sympy;
        this.appliesTo = appliesTo != null ? new ArrayList<>(appliesTo) : null;
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.ADD_CONSTRAINT;
    }

    public String getLatex() {
        return latex;
    }

    public String getSympy() {
        return sympy;
    }

    @JsonProperty("applies_to")
    public List<String> getAppliesTo() {
        return appliesTo;
    }
}
