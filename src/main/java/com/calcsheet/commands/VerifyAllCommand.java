package com.calcsheet.commands;

public class VerifyAllCommand extends WorksheetCommand {

    @Override
    public CommandAction getAction() {
        return CommandAction.VERIFY_ALL;
    }
}
