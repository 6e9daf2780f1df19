package com.calcsheet.commands;

public class VerifyNodeCommand extends NodeTargetCommand {

    public VerifyNodeCommand(String nodeId) {
        super(nodeId);
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.VERIFY_NODE;
    }
}
