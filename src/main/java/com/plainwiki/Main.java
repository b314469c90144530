package com.plainwiki;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plainwiki.content.ContentProcessor;
import com.plainwiki.content.MalformedContentException;
import com.plainwiki.content.ProcessorConfig;
import com.plainwiki.content.WikiLinkResolver;
import com.plainwiki.controllers.Controller;
import com.plainwiki.controllers.WikiController;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

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
            if (config.getPort() != config.getRequestedPort()) {
                logger.warn("Port " + config.getRequestedPort() + " is busy, using " + config.getPort());
                logger.console("  Port " + config.getRequestedPort() + " is busy, using " + config.getPort());
            }

            RouteUrlFormatter routes = new RouteUrlFormatter();
            ProcessorConfig processorConfig = ProcessorConfig.builder()
                    .postProcessor(new WikiLinkResolver(routes))
                    .legacyRatingFold(config.isLegacyRatingFold())
                    .build();
            WikiRepository wiki = new WikiRepository(config.getContentPath(), new ContentProcessor(processorConfig));
            initializeContentRoot(wiki);
            logger.info("Content root: " + wiki.getRoot());

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            Controller controller = new WikiController(wiki, objectMapper);
            controller.registerRoutes(app);
            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Content: " + wiki.getRoot());
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
            System.err.println("Failed to start PlainWiki: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  PlainWiki v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
        if (config.isLegacyRatingFold()) {
            logger.console("  Ratings: legacy fold on read");
        }
    }

    /**
     * Create the content root with a home page on first start.
     */
    static void initializeContentRoot(WikiRepository wiki) throws IOException {
        Path root = wiki.getRoot();
        if (Files.exists(root)) {
            return;
        }
        Files.createDirectories(root);
        wiki.create("home", "system", "Home",
            "# Welcome\n\n" +
            "This wiki keeps every page as a markdown file under the content root.\n\n" +
            "Link to other pages with [[Page Name]] or [[page/sub page|a label]].\n\n" +
            "# Formatting\n\n" +
            "| Syntax | Result |\n" +
            "|--------|--------|\n" +
            "| `[[Target]]` | link to target |\n" +
            "| `# Heading` | entry in the contents block |\n");
        AppLogger.get().info("Seeded content root " + root);
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(PageNotFoundException.class, (e, ctx) -> {
            logger.warn("Not found: " + e.getUrl());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(PathEscapeException.class, (e, ctx) -> {
            logger.warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        });

        app.exception(FileAlreadyExistsException.class, (e, ctx) -> {
            ctx.status(409).json(Map.of("error", e.getReason() != null ? e.getReason() : e.getFile()));
        });

        app.exception(MalformedContentException.class, (e, ctx) -> {
            logger.warn("Malformed page: " + e.getMessage());
            ctx.status(422).json(Controller.errorBody(e));
        });

        app.exception(PatternSyntaxException.class, (e, ctx) -> {
            ctx.status(400).json(Map.of("error", "Invalid search pattern: " + e.getDescription()));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
