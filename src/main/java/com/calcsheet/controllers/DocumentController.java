package com.calcsheet.controllers;

import com.calcsheet.AppLogger;
import com.calcsheet.context.ChatContextBuilder;
import com.calcsheet.document.DocumentModel;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Read-only views of the worksheet: the document itself and the chat context built from it.
 */
public class DocumentController implements Controller {

    private final DocumentModel document;
    private final ChatContextBuilder contextBuilder;
    private final AppLogger logger;

    public DocumentController(DocumentModel document, ChatContextBuilder contextBuilder) {
        this.document = document;
        this.contextBuilder = contextBuilder;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/document", this::getDocument);
        app.get("/api/context", this::getContext);
    }

    private void getDocument(Context ctx) {
        ctx.json(document.snapshot());
    }

    private void getContext(Context ctx) {
        int maxRefs = ChatContextBuilder.DEFAULT_MAX_NODE_REFS;
        String maxParam = ctx.queryParam("maxNodeRefs");
        if (maxParam != null && !maxParam.isBlank()) {
            try {
                maxRefs = Integer.parseInt(maxParam.trim());
            } catch (NumberFormatException e) {
                ctx.status(400).json(Map.of("error", "maxNodeRefs must be an integer"));
                return;
            }
        }
        try {
            ctx.json(contextBuilder.build(document.getNodes(), document.getAssumptions(),
                ctx.queryParam("focus"), ctx.queryParam("query"), maxRefs));
        } catch (Exception e) {
            logger.error("Error building chat context: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
