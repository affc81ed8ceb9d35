package org.sensitiveword.service.bootstrap;

import org.sensitiveword.core.dictionary.DictionaryLoader;
import org.sensitiveword.core.filter.FilterEngine;
import org.sensitiveword.core.index.BinaryIndexStore;
import org.sensitiveword.core.matcher.AutomatonBuilder;
import org.sensitiveword.core.registry.MatcherRegistry;
import org.sensitiveword.core.service.SensitiveWordService;
import org.sensitiveword.service.config.FilterConfig;
import org.sensitiveword.service.controller.FilterController;
import org.sensitiveword.service.web.FilterHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Sensitive Word Filter service.
 *
 * <p>Loads configuration, prepares the model directories, brings the matcher registry to its ready state,
 * starts the HTTP API, and registers a JVM shutdown hook for clean termination.</p>
 */
public final class FilterBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(FilterBootstrap.class);

    private FilterBootstrap() {}

    /**
     * Starts the service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}. No traffic is served without a
     * matcher.</p>
     */
    public static void run(String[] args) {
        if (FilterConfig.isHelpRequested(args)) {
            printUsage();
            return;
        }

        try {
            start(args);
        } catch (Exception e) {
            logger.error("Failed to start Sensitive Word Filter", e);
            printUsage();
            System.exit(1);
        }
    }

    private static void start(String[] args) throws IOException {
        FilterConfig cfg = FilterConfig.load(args);
        logConfiguration(cfg);
        prepareDirectories(cfg.storage());
        MatcherRegistry registry = startRegistry(cfg);
        SensitiveWordService service = new SensitiveWordService(registry, new FilterEngine(cfg.maskChar()));
        Javalin app = startHttp(cfg, service);
        addShutdownHook(app);
        logger.info("Sensitive Word Filter listening on {}:{}", cfg.server().host(), app.port());
    }

    private static void logConfiguration(FilterConfig cfg) {
        logger.info("Starting Sensitive Word Filter...");
        logger.info("Configuration:");
        logger.info("  Host: {}", cfg.server().host());
        logger.info("  Port: {}", cfg.server().port());
        logger.info("  Dictionary: {}", cfg.storage().dictionaryPath());
        logger.info("  Index: {}", cfg.storage().indexPath());
        logger.info("  Rebuild on start: {}", cfg.rebuildOnStart());
    }

    private static void prepareDirectories(FilterConfig.Storage storage) throws IOException {
        createIfMissing(storage.modelsDir());
        createIfMissing(storage.sourceDir());
    }

    private static void createIfMissing(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            logger.info("Created directory {}", dir);
        }
    }

    private static MatcherRegistry startRegistry(FilterConfig cfg) {
        MatcherRegistry registry = new MatcherRegistry(
            new DictionaryLoader(),
            new AutomatonBuilder(),
            new BinaryIndexStore(),
            cfg.storage().dictionaryPath(),
            cfg.storage().indexPath()
        );
        if (cfg.rebuildOnStart()) {
            logger.info("Rebuilding index as requested");
        }
        registry.initialize(cfg.rebuildOnStart());
        return registry;
    }

    private static Javalin startHttp(FilterConfig cfg, SensitiveWordService service) {
        return FilterHttpServer.start(cfg.server(), new FilterController(service));
    }

    private static void addShutdownHook(Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app)));
    }

    private static void shutdown(Javalin app) {
        logger.info("Shutting down Sensitive Word Filter...");
        app.stop();
        logger.info("Sensitive Word Filter stopped.");
    }

    /**
     * Print usage information
     */
    private static void printUsage() {
        System.out.println("\n=== Sensitive Word Filter Usage ===\n");
        System.out.println("Usage: java -jar filter-service-1.0.0.jar [options]\n");
        System.out.println("Options:");
        System.out.println("  --host <address>              Bind address (default: 127.0.0.1)");
        System.out.println("  --port <port>                 Server port (default: 3000)");
        System.out.println("  --path <dir>                  Base directory holding models/ (default: ./)");
        System.out.println("  --dictionary.path <file>      Word list (default: <path>/models/source/dic.txt)");
        System.out.println("  --index.path <file>           Persisted index (default: <path>/models/ac_index.bin)");
        System.out.println("  --filter.mask.char <char>     Mask character used by /filter (default: *)");
        System.out.println("  -r, --rebuild                 Rebuild the index from the word list on start");
        System.out.println("  -h, --help                    Show this help message\n");
        System.out.println("Examples:");
        System.out.println("  # Serve the existing index, or build it on first run");
        System.out.println("  java -jar filter-service-1.0.0.jar\n");
        System.out.println("  # Custom port and data directory, forcing a rebuild");
        System.out.println("  java -jar filter-service-1.0.0.jar --port 8080 --path /srv/filter --rebuild\n");
    }
}
