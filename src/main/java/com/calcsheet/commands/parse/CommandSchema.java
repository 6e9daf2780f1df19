package com.calcsheet.commands.parse;

import com.calcsheet.commands.CommandAction;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal per-action schema: which fields must be present and their primitive type.
 * Unknown fields are tolerated.
 */
public class CommandSchema {
    private final CommandAction action;
    private final Map<String, CommandArgSpec> args = new LinkedHashMap<>();

    public CommandSchema(CommandAction action) {
        this.action = action;
    }

    public CommandSchema arg(String name, CommandArgSpec.Type type, boolean required) {
        args.put(name, new CommandArgSpec(name, type, required));
        return this;
    }

    public CommandAction getAction() {
        return action;
    }

    public Map<String, CommandArgSpec> getArgSpecs() {
        return Collections.unmodifiableMap(args);
    }

    public CommandArgSpec getArgSpec(String name) {
        return args.get(name);
    }

    /**
     * @return null when the object satisfies the schema, otherwise a short error code
     */
    public String validate(JsonNode commandNode) {
        if (commandNode == null || !commandNode.isObject()) {
            return "command-not-object";
        }
        for (CommandArgSpec spec : args.values()) {
            String error = spec.validate(commandNode.get(spec.getName()));
            if (error != null) {
                return error;
            }
        }
        return null;
    }
}
