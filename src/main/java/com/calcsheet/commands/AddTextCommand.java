package com.calcsheet.commands;

public class AddTextCommand extends WorksheetCommand {
    private final String content;

    public AddTextCommand(String content) {
        this.content = content;
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.ADD_TEXT;
    }

    public String getContent() {
        return content;
    }
}
