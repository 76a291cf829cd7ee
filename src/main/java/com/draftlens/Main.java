package com.draftlens;

import com.draftlens.analysis.AnalysisEngine;
import com.draftlens.controllers.AnalysisController;
import com.draftlens.controllers.Controller;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;

public class Main {

    static final String VERSION = "1.0.0";
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

            Javalin app = createApp(config);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Max analysis length: " + config.getMaxAnalysisLength() + " chars");
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start DraftLens: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Builds the configured but not yet started server.
     */
    static Javalin createApp(AppConfig config) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
            cfg.http.maxRequestSize = Math.max(1_000_000L, config.getMaxAnalysisLength() * 8L);
        });

        List<Controller> controllers = List.of(
                new AnalysisController(new AnalysisEngine(), objectMapper, config.getMaxAnalysisLength(), VERSION));
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger current = AppLogger.get();
            if (current != null) {
                current.error("Unhandled exception: " + e.getMessage(), e);
            }
            ctx.status(500).json(Controller.errorBody(e));
        });
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  DraftLens v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }
}
