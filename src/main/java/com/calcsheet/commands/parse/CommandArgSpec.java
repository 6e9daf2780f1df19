package com.calcsheet.commands.parse;

import com.fasterxml.jackson.databind.JsonNode;

public class CommandArgSpec {
    public enum Type {
        STRING,
        NUMBER,
        OBJECT,
        STRING_ARRAY
    }

    private final String name;
    private final Type type;
    private final boolean required;

    public CommandArgSpec(String name, Type type, boolean required) {
        this.name = name;
        this.type = type;
        this.required = required;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Checks presence and primitive type only. Optional fields of the wrong type are not an error;
     * the parser reads them as absent.
     */
    public String validate(JsonNode node) {
        if (node == null || node.isNull()) {
            return required ? "missing-required:" + name : null;
        }
        if (!required) {
            return null;
        }
        return matches(node) ? null : "invalid-type:" + name;
    }

    public boolean matches(JsonNode node) {
        if (node == null || node.isNull()) {
            return false;
        }
        switch (type) {
            case STRING:
                return node.isTextual();
            case NUMBER:
                return node.isNumber();
            case OBJECT:
                return node.isObject();
            case STRING_ARRAY:
                if (!node.isArray()) {
                    return false;
                }
                for (JsonNode child : node) {
                    if (!child.isTextual()) {
                        return false;
                    }
                }
                return true;
            default:
                return false;
        }
    }
}
