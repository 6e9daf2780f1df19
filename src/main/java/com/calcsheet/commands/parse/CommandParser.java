package com.calcsheet.commands.parse;

import com.calcsheet.commands.AddAnnotationCommand;
import com.calcsheet.commands.AddAssumptionCommand;
import com.calcsheet.commands.AddConstraintCommand;
import com.calcsheet.commands.AddEquationCommand;
import com.calcsheet.commands.AddGivenCommand;
import com.calcsheet.commands.AddSolveGoalCommand;
import com.calcsheet.commands.AddTextCommand;
import com.calcsheet.commands.CommandAction;
import com.calcsheet.commands.DeleteNodeCommand;
import com.calcsheet.commands.RemoveAssumptionCommand;
import com.calcsheet.commands.UpdateNodeCommand;
import com.calcsheet.commands.VerifyAllCommand;
import com.calcsheet.commands.VerifyNodeCommand;
import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.models.SolveMethod;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls command objects out of fenced blocks in a model reply.
 *
 * Accepted block contents: {@code {"commands": [...]}}, a single {@code {"action": ...}} object,
 * or an array of such objects. Malformed blocks and objects that fail their schema are dropped
 * without a trace; model output is not trusted to be well formed.
 */
public class CommandParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(json)?[ \\t\\x0B\\f\\r]*\\n([\\s\\S]*?)\\n```");
    private static final Pattern STRIPPABLE_BLOCK = Pattern.compile("```(?:json)?\\s*\\n[\\s\\S]*?\\n```");
    private static final Pattern ACTION_KEY = Pattern.compile("\"action\"\\s*:");

    private final ObjectMapper objectMapper;
    private final CommandSchemaRegistry schemaRegistry;

    public CommandParser(ObjectMapper objectMapper) {
        this(objectMapper, CommandSchemaRegistry.defaults());
    }

    public CommandParser(ObjectMapper objectMapper, CommandSchemaRegistry schemaRegistry) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.schemaRegistry = schemaRegistry;
    }

    public CommandBatch parse(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return CommandBatch.empty();
        }
        List<WorksheetCommand> commands = new ArrayList<>();
        String summary = null;
        for (String block : extractBlocks(responseText)) {
            JsonNode parsed;
            try {
                parsed = objectMapper.readTree(block);
            } catch (JsonProcessingException e) {
                continue;
            }
            if (parsed == null) {
                continue;
            }
            if (parsed.isObject() && parsed.path("commands").isArray()) {
                for (JsonNode candidate : parsed.get("commands")) {
                    addIfValid(candidate, commands);
                }
                if (summary == null && parsed.path("summary").isTextual()) {
                    summary = parsed.get("summary").asText();
                }
            } else if (parsed.isObject() && parsed.hasNonNull("action")) {
                addIfValid(parsed, commands);
            } else if (parsed.isArray()) {
                for (JsonNode candidate : parsed) {
                    addIfValid(candidate, commands);
                }
            }
        }
        return new CommandBatch(commands, summary);
    }

    /**
     * Cheap existence test: is there a candidate block that mentions an action key.
     * Does not decode or validate.
     */
    public boolean hasCommands(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return false;
        }
        for (String block : extractBlocks(responseText)) {
            if (ACTION_KEY.matcher(block).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes every command-capable fenced block, leaving the prose for display.
     */
    public static String stripCommandBlocks(String text) {
        if (text == null) {
            return "";
        }
        return STRIPPABLE_BLOCK.matcher(text).replaceAll("").trim();
    }

    /**
     * Contents of {@code json}-tagged blocks, or of untagged blocks when no tagged one exists.
     */
    List<String> extractBlocks(String text) {
        List<String> tagged = new ArrayList<>();
        List<String> untagged = new ArrayList<>();
        Matcher m = FENCED_BLOCK.matcher(text);
        while (m.find()) {
            String content = m.group(2).trim();
            if (m.group(1) != null) {
                tagged.add(content);
            } else {
                untagged.add(content);
            }
        }
        return tagged.isEmpty() ? untagged : tagged;
    }

    private void addIfValid(JsonNode candidate, List<WorksheetCommand> out) {
        WorksheetCommand command = toCommand(candidate);
        if (command != null) {
            out.add(command);
        }
    }

    /**
     * Schema-checks one decoded object and builds its typed command, or returns null.
     */
    WorksheetCommand toCommand(JsonNode node) {
        if (node == null || !node.isObject() || !node.path("action").isTextual()) {
            return null;
        }
        CommandAction action = CommandAction.fromWire(node.get("action").asText());
        if (action == null || schemaRegistry == null || !schemaRegistry.hasAction(action)) {
            return null;
        }
        CommandSchema schema = schemaRegistry.getSchema(action);
        if (schema.validate(node) != null) {
            return null;
        }

        WorksheetCommand command;
        switch (action) {
            case ADD_GIVEN:
                command = new AddGivenCommand(text(node, "symbol"), node.get("value").asDouble(),
                    optionalText(schema, node, "unit"), optionalText(schema, node, "description"));
                break;
            case ADD_EQUATION:
                command = new AddEquationCommand(text(node, "latex"), text(node, "lhs"), text(node, "rhs"));
                break;
            case ADD_CONSTRAINT:
                command = new AddConstraintCommand(text(node, "latex"), text(node, "sympy"),
                    optionalList(schema, node, "applies_to"));
                break;
            case ADD_SOLVE_GOAL:
                command = new AddSolveGoalCommand(text(node, "target"),
                    SolveMethod.fromWire(optionalText(schema, node, "method")));
                break;
            case ADD_TEXT:
                command = new AddTextCommand(text(node, "content"));
                break;
            case ADD_ANNOTATION:
                command = new AddAnnotationCommand(text(node, "content"), optionalText(schema, node, "title"));
                break;
            case UPDATE_NODE:
                command = new UpdateNodeCommand(text(node, "node_id"), toMap(node.get("updates")));
                break;
            case DELETE_NODE:
                command = new DeleteNodeCommand(text(node, "node_id"));
                break;
            case ADD_ASSUMPTION:
                command = new AddAssumptionCommand(text(node, "statement"),
                    optionalText(schema, node, "formal_expression"), optionalList(schema, node, "scope"));
                break;
            case REMOVE_ASSUMPTION:
                command = new RemoveAssumptionCommand(text(node, "assumption_id"));
                break;
            case VERIFY_NODE:
                command = new VerifyNodeCommand(text(node, "node_id"));
                break;
            case VERIFY_ALL:
                command = new VerifyAllCommand();
                break;
            default:
                return null;
        }
        if (node.path("reasoning").isTextual()) {
            command.setReasoning(node.get("reasoning").asText());
        }
        return command;
    }

    private static String text(JsonNode node, String field) {
        return node.get(field).asText();
    }

    private static String optionalText(CommandSchema schema, JsonNode node, String field) {
        JsonNode value = node.get(field);
        CommandArgSpec spec = schema.getArgSpec(field);
        return spec != null && spec.matches(value) ? value.asText() : null;
    }

    private static List<String> optionalList(CommandSchema schema, JsonNode node, String field) {
        JsonNode value = node.get(field);
        CommandArgSpec spec = schema.getArgSpec(field);
        if (spec == null || !spec.matches(value)) {
            return null;
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            items.add(item.asText());
        }
        return items;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(JsonNode node) {
        return objectMapper.convertValue(node, Map.class);
    }
}
