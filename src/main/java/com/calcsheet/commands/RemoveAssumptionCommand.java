package com.calcsheet.commands;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RemoveAssumptionCommand extends WorksheetCommand {
    private String assumptionId;

    public RemoveAssumptionCommand(String assumptionId) {
        this.assumptionId = assumptionId;
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.REMOVE_ASSUMPTION;
    }

    @JsonProperty("assumption_id")
    public String getAssumptionId() {
        return assumptionId;
    }

    public void setAssumptionId(String assumptionId) {
        this.assumptionId = assumptionId;
    }
}
