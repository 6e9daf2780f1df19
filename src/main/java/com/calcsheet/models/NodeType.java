package com.calcsheet.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeType {
    GIVEN("given"),
    EQUATION("equation"),
    CONSTRAINT("constraint"),
    SOLVE_GOAL("solve_goal"),
    RESULT("result"),
    TEXT("text"),
    ANNOTATION("annotation"),
    PLOT("plot");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Accepts the wire name plus the hyphenated and joined spellings of solve goal.
     */
    public static NodeType fromWire(String value) {
        if (value == null) {
            return null;
        }
        String key = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("solvegoal".equals(key)) {
            return SOLVE_GOAL;
        }
        for (NodeType type : values()) {
            if (type.wireName.equals(key)) {
                return type;
            }
        }
        return null;
    }
}
