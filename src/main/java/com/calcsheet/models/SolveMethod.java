package com.calcsheet.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SolveMethod {
    SYMBOLIC("symbolic"),
    NUMERIC("numeric"),
    AUTO("auto");

    private final String wireName;

    SolveMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static SolveMethod fromWire(String value) {
        if (value == null) {
            return null;
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (SolveMethod method : values()) {
            if (method.wireName.equals(key)) {
                return method;
            }
        }
        return null;
    }
}
