package org.sensitiveword.service.web;

import org.sensitiveword.service.config.FilterConfig;
import org.sensitiveword.service.controller.FilterController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

/** HTTP server wiring for the Sensitive Word Filter service. */
public final class FilterHttpServer {
    private static final Logger logger = LoggerFactory.getLogger(FilterHttpServer.class);

    private FilterHttpServer() {}

    /**
     * Creates the Javalin app with JSON defaults, the request size limit and request logging, and registers
     * routes. The returned app is not started.
     *
     * @param server listener settings
     * @param controller controller that registers routes
     * @return configured {@link Javalin} instance
     */
    public static Javalin create(FilterConfig.Server server, FilterController controller) {
        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.http.defaultContentType = "application/json";
            javalinConfig.http.maxRequestSize = server.maxRequestBytes();
            javalinConfig.showJavalinBanner = false;
            javalinConfig.requestLogger.http((ctx, executionTimeMs) ->
                logger.debug("{} {} -> {} in {} ms", ctx.method(), ctx.path(), ctx.status(), executionTimeMs));
        });
        controller.registerRoutes(app);
        return app;
    }

    /**
     * Starts the Javalin HTTP server and registers routes.
     *
     * @param server listener settings
     * @param controller controller that registers routes
     * @return started {@link Javalin} instance
     */
    public static Javalin start(FilterConfig.Server server, FilterController controller) {
        return create(server, controller).start(server.host(), server.port());
    }
}
