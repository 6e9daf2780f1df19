package com.calcsheet.commands;

public class AddGivenCommand extends WorksheetCommand {
    private final String symbol;
    private final double value;
    private final String unit;
    private final String description;

    public AddGivenCommand(String symbol, double value, String unit, String description) {
        this.symbol = symbol;
        this.value = value;
        this.unit = unit;
        this.description = description;
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.ADD_GIVEN;
    }

    public String getSymbol() {
        return symbol;
    }

    public double getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public String getDescription() {
        return description;
    }
}
