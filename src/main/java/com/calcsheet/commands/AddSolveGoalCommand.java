package com.calcsheet.commands;

import com.calcsheet.models.SolveMethod;

public class AddSolveGoalCommand extends WorksheetCommand {
    private final String target;
    private final SolveMethod method;

    public AddSolveGoalCommand(String target, SolveMethod method) {
        this.target = target;
        this.method = method;
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.ADD_SOLVE_GOAL;
    }

    public String getTarget() {
        return target;
    }

    public SolveMethod getMethod() {
        return method;
    }
}
