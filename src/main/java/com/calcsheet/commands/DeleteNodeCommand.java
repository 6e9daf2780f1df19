package com.calcsheet.commands;

public class DeleteNodeCommand extends NodeTargetCommand {

    public DeleteNodeCommand(String nodeId) {
        super(nodeId);
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.DELETE_NODE;
    }
}
