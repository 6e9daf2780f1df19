package com.calcsheet.proposals;

import com.calcsheet.AppLogger;
import com.calcsheet.commands.BatchResult;
import com.calcsheet.commands.WorksheetCommand;
import com.calcsheet.commands.execute.CommandExecutor;
import com.calcsheet.commands.parse.CommandBatch;
import com.calcsheet.commands.parse.CommandParser;
import com.calcsheet.commands.validate.CommandValidator;
import com.calcsheet.commands.validate.ValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Proposal lifecycle: parse and validate a model reply, hold it until the user decides,
 * then execute or discard it. Each proposal is consumed at most once.
 */
public class ProposalService {

    public static final int DEFAULT_MAX_PENDING = 50;

    private final CommandParser parser;
    private final CommandValidator validator;
    private final CommandExecutor executor;
    private final int maxPending;
    private final Map<String, Proposal> pending = Collections.synchronizedMap(new LinkedHashMap<>());

    public ProposalService(CommandParser parser, CommandValidator validator, CommandExecutor executor) {
        this(parser, validator, executor, DEFAULT_MAX_PENDING);
    }

    /**
     * @param maxPending undecided proposals kept; the oldest is dropped when a new one exceeds it
     */
    public ProposalService(CommandParser parser, CommandValidator validator, CommandExecutor executor, int maxPending) {
        if (maxPending < 1) {
            throw new IllegalArgumentException("maxPending must be at least 1");
        }
        this.parser = parser;
        this.validator = validator;
        this.executor = executor;
        this.maxPending = maxPending;
    }

    /**
     * Parses, resolves and validates. A reply without commands still yields a proposal with an empty batch.
     */
    public Proposal propose(String responseText) {
        CommandBatch batch = parser.parse(responseText);
        List<WorksheetCommand> commands = new ArrayList<>(batch.getCommands());
        List<ValidationResult> verdicts = validator.validateBatch(commands);
        boolean blocked = CommandValidator.hasInvalidCommands(verdicts);

        Proposal proposal = new Proposal(UUID.randomUUID().toString(), CommandParser.stripCommandBlocks(responseText),
            batch.getSummary(), commands, verdicts, blocked, System.currentTimeMillis());
        pending.put(proposal.getId(), proposal);
        evictOldest();
        log("Proposal " + proposal.getId() + ": " + commands.size() + " command(s)" + (blocked ? ", blocked" : ""));
        return proposal;
    }

    public Proposal get(String id) {
        Proposal proposal = id != null ? pending.get(id) : null;
        if (proposal == null) {
            throw new ProposalNotFoundException(id);
        }
        return proposal;
    }

    public List<Proposal> list() {
        List<Proposal> results;
        synchronized (pending) {
            results = new ArrayList<>(pending.values());
        }
        results.sort(Comparator.comparingLong(Proposal::getCreatedAt));
        return results;
    }

    /**
     * Executes the proposal. A blocked proposal stays pending so it can still be rejected.
     */
    public BatchResult accept(String id) {
        Proposal proposal = get(id);
        if (proposal.isBlocked()) {
            logWarning("Refused to accept blocked proposal " + id);
            throw new ProposalBlockedException(id);
        }
        if (!pending.remove(id, proposal)) {
            throw new ProposalNotFoundException(id);
        }
        log("Accepted proposal " + id);
        return executor.executeBatch(proposal.getCommands());
    }

    public Proposal reject(String id) {
        Proposal proposal = id != null ? pending.remove(id) : null;
        if (proposal == null) {
            throw new ProposalNotFoundException(id);
        }
        log("Rejected proposal " + id);
        return proposal;
    }

    private void evictOldest() {
        synchronized (pending) {
            Iterator<Proposal> oldestFirst = pending.values().iterator();
            while (pending.size() > maxPending && oldestFirst.hasNext()) {
                Proposal oldest = oldestFirst.next();
                oldestFirst.remove();
                logWarning("Dropped undecided proposal " + oldest.getId() + " (limit " + maxPending + ")");
            }
        }
    }

    private void log(String message) {
        AppLogger.get().info("[ProposalService] " + message);
    }

    private void logWarning(String message) {
        AppLogger.get().warn("[ProposalService] " + message);
    }
}
