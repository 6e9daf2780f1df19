package com.calcsheet.commands;

/**
 * Outcome of applying one command.
 */
public class CommandResult {
    private final WorksheetCommand command;
    private final boolean success;
    private final String error;
    private final String nodeId;

    private CommandResult(WorksheetCommand command, boolean success, String error, String nodeId) {
        this.command = command;
        this.success = success;
        this.error = error;
        this.nodeId = nodeId;
    }

    public static CommandResult success(WorksheetCommand command, String nodeId) {
        return new CommandResult(command, true, null, nodeId);
    }

    public static CommandResult failure(WorksheetCommand command, String error) {
        return new CommandResult(command, false, error, null);
    }

    public WorksheetCommand getCommand() {
        return command;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    /** Id of the node created or touched, when there is one. */
    public String getNodeId() {
        return nodeId;
    }
}
