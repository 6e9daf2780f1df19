package com.calcsheet.commands;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial field update. Values are decoded JSON: strings, numbers, booleans, maps and lists.
 */
public class UpdateNodeCommand extends NodeTargetCommand {
    private final Map<String, Object> updates;

    public UpdateNodeCommand(String nodeId, Map<String, Object> updates) {
        super(nodeId);
        this.updates = updates != null ? new LinkedHashMap<>(updates) : new LinkedHashMap<>();
    }

    @Override
    public CommandAction getAction() {
        return CommandAction.UPDATE_NODE;
    }

    public Map<String, Object> getUpdates() {
        return Collections.unmodifiableMap(updates);
    }
}
