package com.calcsheet.commands;

public class AddEquationCommand extends WorksheetCommand {
    private final String latex;
    private final String lhs;
    private final String rhs;

    public AddEquationCommand(String latex, String lhs, String rhs) {
        this.latex = latex;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.ADD_EQUATION;
    }

    public String getLatex() {
        return latex;
    }

    public String getLhs() {
        return lhs;
    }

    public String getRhs() {
        return rhs;
    }
}
