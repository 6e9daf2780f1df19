package com.calcsheet.commands;

public class AddAnnotationCommand extends WorksheetCommand {
    private final String content;
    private final String title;

    public AddAnnotationCommand(String content, String title) {
        this.content = content;
        this.title = title;
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.ADD_ANNOTATION;
    }

    public String getContent() {
        return content;
    }

    public String getTitle() {
        return title;
    }
}
