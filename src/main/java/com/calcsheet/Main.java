package com.calcsheet;

import com.calcsheet.commands.execute.CommandExecutor;
import com.calcsheet.commands.parse.CommandParser;
import com.calcsheet.commands.validate.CommandValidator;
import com.calcsheet.compute.ComputeServiceClient;
import com.calcsheet.context.ChatContextBuilder;
import com.calcsheet.controllers.CommandController;
import com.calcsheet.controllers.Controller;
import com.calcsheet.controllers.DocumentController;
import com.calcsheet.document.InMemoryDocumentModel;
import com.calcsheet.proposals.ProposalService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();
            printBanner(config);

            ComputeServiceClient computeClient = new ComputeServiceClient(
                objectMapper, config.getComputeUrl(), config.getUnitCheckTimeoutMs());
            InMemoryDocumentModel document = new InMemoryDocumentModel(computeClient);
            CommandParser parser = new CommandParser(objectMapper);
            CommandValidator validator = new CommandValidator(document, computeClient);
            CommandExecutor executor = new CommandExecutor(document);
            ProposalService proposalService = new ProposalService(parser, validator, executor);
            logger.info("Compute engine: " + computeClient.getBaseUrl());

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                new CommandController(parser, proposalService, objectMapper),
                new DocumentController(document, new ChatContextBuilder())
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }
            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start command engine: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Calcsheet command engine v" + VERSION);
        logger.console("========================================");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            logger.warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
