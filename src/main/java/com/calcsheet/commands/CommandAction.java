package com.calcsheet.commands;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Edit intents a model may propose, keyed by their wire name.
 */
public enum CommandAction {
    ADD_GIVEN("add_given", true),
    ADD_EQUATION("add_equation", true),
    ADD_CONSTRAINT("add_constraint", true),
    ADD_SOLVE_GOAL("add_solve_goal", true),
    ADD_TEXT("add_text", true),
    ADD_ANNOTATION("add_annotation", true),
    UPDATE_NODE("update_node", false),
    DELETE_NODE("delete_node", false),
    ADD_ASSUMPTION("add_assumption", false),
    REMOVE_ASSUMPTION("remove_assumption", false),
    VERIFY_NODE("verify_node", false),
    VERIFY_ALL("verify_all", false);

    private final String wireName;
    private final boolean createsNode;

    CommandAction(String wireName, boolean createsNode) {
        this.wireName = wireName;
        this.createsNode = createsNode;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean createsNode() {
        return createsNode;
    }

    public static CommandAction fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (CommandAction action : values()) {
            if (action.wireName.equals(value)) {
                return action;
            }
        }
        return null;
    }
}
