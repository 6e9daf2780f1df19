package com.calcsheet.controllers;

import com.calcsheet.AppLogger;
import com.calcsheet.commands.BatchResult;
import com.calcsheet.commands.parse.CommandBatch;
import com.calcsheet.commands.parse.CommandParser;
import com.calcsheet.proposals.Proposal;
import com.calcsheet.proposals.ProposalBlockedException;
import com.calcsheet.proposals.ProposalNotFoundException;
import com.calcsheet.proposals.ProposalService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command parsing and the propose / accept / reject endpoints.
 */
public class CommandController implements Controller {

    private final CommandParser parser;
    private final ProposalService proposalService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public CommandController(CommandParser parser, ProposalService proposalService, ObjectMapper objectMapper) {
        this.parser = parser;
        this.proposalService = proposalService;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/commands/parse", this::parseCommands);
        app.get("/api/proposals", this::listProposals);
        app.post("/api/proposals", this::createProposal);
        app.get("/api/proposals/{id}", this::getProposal);
        app.post("/api/proposals/{id}/accept", this::acceptProposal);
        app.post("/api/proposals/{id}/reject", this::rejectProposal);
    }

    private void parseCommands(Context ctx) {
        try {
            String text = readText(ctx);
            if (text == null) {
                return;
            }
            CommandBatch batch = parser.parse(text);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("commands", batch.getCommands());
            if (batch.getSummary() != null) {
                body.put("summary", batch.getSummary());
            }
            body.put("prose", CommandParser.stripCommandBlocks(text));
            body.put("hasCommands", parser.hasCommands(text));
            ctx.json(body);
        } catch (Exception e) {
            logger.error("Error parsing commands: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void listProposals(Context ctx) {
        ctx.json(proposalService.list());
    }

    private void createProposal(Context ctx) {
        try {
            String text = readText(ctx);
            if (text == null) {
                return;
            }
            Proposal proposal = proposalService.propose(text);
            ctx.status(201).json(proposal);
        } catch (Exception e) {
            logger.error("Error creating proposal: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getProposal(Context ctx) {
        try {
            ctx.json(proposalService.get(ctx.pathParam("id")));
        } catch (ProposalNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        }
    }

    private void acceptProposal(Context ctx) {
        String id = ctx.pathParam("id");
        try {
            BatchResult result = proposalService.accept(id);
            ctx.json(result);
        } catch (ProposalNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (ProposalBlockedException e) {
            ctx.status(409).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error accepting proposal " + id + ": " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void rejectProposal(Context ctx) {
        try {
            Proposal proposal = proposalService.reject(ctx.pathParam("id"));
            ctx.json(Map.of("rejected", proposal.getId()));
        } catch (ProposalNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        }
    }

    /**
     * Reads {@code {"text": "..."}}. Answers 400 and returns null when the body is unusable.
     */
    private String readText(Context ctx) {
        JsonNode json;
        try {
            json = objectMapper.readTree(ctx.body());
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Request body must be JSON"));
            return null;
        }
        if (json == null || !json.path("text").isTextual()) {
            ctx.status(400).json(Map.of("error", "text is required"));
            return null;
        }
        return json.get("text").asText();
    }
}
