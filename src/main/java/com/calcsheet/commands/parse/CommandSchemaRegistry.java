package com.calcsheet.commands.parse;

import com.calcsheet.commands.CommandAction;

import java.util.EnumMap;
import java.util.Map;

public class CommandSchemaRegistry {
    private final Map<CommandAction, CommandSchema> schemas = new EnumMap<>(CommandAction.class);

    public CommandSchemaRegistry register(CommandSchema schema) {
        if (schema != null && schema.getAction() != null) {
            schemas.put(schema.getAction(), schema);
        }
        return this;
    }

    public boolean hasAction(CommandAction action) {
        return action != null && schemas.containsKey(action);
    }

    public CommandSchema getSchema(CommandAction action) {
        return action != null ? schemas.get(action) : null;
    }

    /**
     * Schemas for every action of the command protocol.
     */
    public static CommandSchemaRegistry defaults() {
        return new CommandSchemaRegistry()
            .register(new CommandSchema(CommandAction.ADD_GIVEN)
                .arg("symbol", CommandArgSpec.Type.STRING, true)
                .arg("value", CommandArgSpec.Type.NUMBER, true)
                .arg("unit", CommandArgSpec.Type.STRING, false)
                .arg("description", CommandArgSpec.Type.STRING, false))
            .register(new CommandSchema(CommandAction.ADD_EQUATION)
                .arg("latex", CommandArgSpec.Type.STRING, true)
                .arg("lhs", CommandArgSpec.Type.STRING, true)
                .arg("rhs", CommandArgSpec.Type.STRING, true))
            .register(new CommandSchema(CommandAction.ADD_CONSTRAINT)
                .arg("latex", CommandArgSpec.Type.STRING, true)
                .arg("sympy", CommandArgSpec.Type.STRING, true)
                .arg("applies_to", CommandArgSpec.Type.STRING_ARRAY, false))
            .register(new CommandSchema(CommandAction.ADD_SOLVE_GOAL)
                .arg("target", CommandArgSpec.Type.STRING, true)
                .arg("method", CommandArgSpec.Type.STRING, false))
            .register(new CommandSchema(CommandAction.ADD_TEXT)
                .arg("content", CommandArgSpec.Type.STRING, true))
            .register(new CommandSchema(CommandAction.ADD_ANNOTATION)
                .arg("content", CommandArgSpec.Type.STRING, true)
                .arg("title", CommandArgSpec.Type.STRING, false))
            .register(new CommandSchema(CommandAction.UPDATE_NODE)
                .arg("node_id", CommandArgSpec.Type.STRING, true)
                .arg("updates", CommandArgSpec.Type.OBJECT, true))
            .register(new CommandSchema(CommandAction.DELETE_NODE)
                .arg("node_id", CommandArgSpec.Type.STRING, true))
            .register(new CommandSchema(CommandAction.ADD_ASSUMPTION)
                .arg("statement", CommandArgSpec.Type.STRING, true)
                .arg("formal_expression", CommandArgSpec.Type.STRING, false)
                .arg("scope", CommandArgSpec.Type.STRING_ARRAY, false))
            .register(new CommandSchema(CommandAction.REMOVE_ASSUMPTION)
                .arg("assumption_id", CommandArgSpec.Type.STRING, true))
            .register(new CommandSchema(CommandAction.VERIFY_NODE)
                .arg("node_id", CommandArgSpec.Type.STRING, true))
            .register(new CommandSchema(CommandAction.VERIFY_ALL));
    }
}
