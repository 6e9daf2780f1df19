package com.calcsheet.commands.validate;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationStatus {
    VALID("valid"),
    WARNING("warning"),
    INVALID("invalid"),
    UNCHECKED("unchecked");

    private final String wireName;

    ValidationStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
