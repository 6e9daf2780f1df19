package com.calcsheet.proposals;

import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.commands.validate.ValidationResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A validated batch waiting for the user to accept or reject it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Proposal {
    private final String id;
    private final String prose;
    private final String summary;
    private final List<WorksheetCommand> commands;
    private final List<ValidationResult> validation;
    private final boolean blocked;
    private final long createdAt;

    public Proposal(String id, String prose, String summary, List<WorksheetCommand> commands,
                    List<ValidationResult> validation, boolean blocked, long createdAt) {
        this.id = id;
        this.prose = prose;
        this.summary = summary;
        this.commands = Collections.unmodifiableList(new ArrayList<>(commands));
        this.validation = Collections.unmodifiableList(new ArrayList<>(validation));
        this.blocked = blocked;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    /** The reply with its command blocks removed. */
    public String getProse() {
        return prose;
    }

    public String getSummary() {
        return summary;
    }

    public List<WorksheetCommand> getCommands() {
        return commands;
    }

    /** One verdict per command, same order. */
    public List<ValidationResult> getValidation() {
        return validation;
    }

    public boolean isBlocked() {
        return blocked;
    }

    public long getCreatedAt() {
        return createdAt;
    }
}
