package com.formstudio;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formstudio.controllers.Controller;
import com.formstudio.controllers.FormController;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.FileNotFoundException;
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

            WorkspaceService workspaceService = new WorkspaceService(config.getWorkspacePath());
            DesignerConfigStore configStore = new DesignerConfigStore(config.getWorkspacePath(), objectMapper);
            FormDesignerService designerService = new FormDesignerService(workspaceService, configStore);
            logger.info("Workspace initialized: " + config.getWorkspacePath());

            Javalin app = createApp(designerService, objectMapper);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Workspace: " + config.getWorkspacePath());
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
            System.err.println("Failed to start " + AppConfig.APP_NAME + ": " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  " + AppConfig.APP_NAME + " v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    /**
     * The API server with its routes and exception mapping, not yet started.
     */
    static Javalin createApp(FormDesignerService designerService, ObjectMapper mapper) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(mapper));
            cfg.http.defaultContentType = "application/json";
        });

        List<Controller> controllers = List.of(new FormController(designerService, mapper));
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }

        registerExceptionHandlers(app);
        return app;
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(FileNotFoundException.class, (e, ctx) -> {
            warn("File not found: " + e.getMessage());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(SecurityException.class, (e, ctx) -> {
            warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        });

        app.exception(IllegalStateException.class, (e, ctx) -> {
            warn("Conflict: " + e.getMessage());
            ctx.status(409).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger log = AppLogger.get();
            if (log != null) {
                log.error("Unhandled exception: " + e.getMessage(), e);
            }
            ctx.status(500).json(Controller.errorBody(e));
        });
    }

    private static void warn(String message) {
        AppLogger log = AppLogger.get();
        if (log != null) {
            log.warn(message);
        }
    }
}
