package com.calcsheet.commands.parse;

import com.calcsheet.commands.WorksheetCommand;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Commands extracted from one model reply, in reply order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandBatch {
    private final List<WorksheetCommand> commands;
    private final String summary;

    public CommandBatch(List<WorksheetCommand> commands, String summary) {
        this.commands = Collections.unmodifiableList(new ArrayList<>(commands));
        this.summary = summary;
    }

    public static CommandBatch empty() {
        return new CommandBatch(List.of(), null);
    }

    public List<WorksheetCommand> getCommands() {
        return commands;
    }

    public String getSummary() {
        return summary;
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }
}
