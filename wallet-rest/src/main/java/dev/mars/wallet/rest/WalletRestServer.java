/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.wallet.rest;

import dev.mars.wallet.api.health.HealthCheck;
import dev.mars.wallet.api.lifecycle.ListenerHandle;
import dev.mars.wallet.api.lifecycle.ServiceListener;
import dev.mars.wallet.api.lifecycle.ServiceStatus;
import dev.mars.wallet.rest.config.WalletServiceConfig;
import dev.mars.wallet.rest.handlers.GlobalErrorHandler;
import dev.mars.wallet.rest.handlers.HealthHandler;
import dev.mars.wallet.rest.handlers.NotFoundHandler;
import dev.mars.wallet.rest.handlers.SecurityHeadersHandler;
import dev.mars.wallet.rest.routes.ApiContext;
import dev.mars.wallet.rest.routes.ApiRoutes;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CSPHandler;
import io.vertx.ext.web.handler.CorsHandler;
import io.vertx.ext.web.handler.HSTSHandler;
import io.vertx.ext.web.handler.LoggerFormat;
import io.vertx.ext.web.handler.LoggerHandler;
import io.vertx.ext.web.handler.XFrameHandler;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * HTTP listener of the wallet service.
 *
 * <p>Deployed by the lifecycle manager only after every dependency initialized. Handlers are
 * installed in this order: request logging, security headers, CORS, body decoding, health
 * endpoints, the {@code /api/v1} route sets, the 404 fallback and the failure handler.</p>
 *
 * <p>Undeploying the verticle shuts the server down gracefully: new connections are refused
 * at once and in-flight requests get the configured shutdown timeout to finish.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class WalletRestServer extends AbstractVerticle implements ServiceListener {

    private static final Logger logger = LoggerFactory.getLogger(WalletRestServer.class);

    public static final String API_MOUNT_POINT = "/api/v1";

    private final WalletServiceConfig config;
    private final ServiceStatus status;
    private final List<HealthCheck> healthChecks;
    private final List<ApiRoutes> apiRoutes;
    private final Supplier<Pool> pool;

    private HttpServer server;
    private volatile ListenerHandle handle;

    /**
     * @param config       validated service configuration
     * @param status       lifecycle view used by the readiness endpoint
     * @param healthChecks checks reported by {@code /health/ready}
     * @param apiRoutes    route sets mounted under {@code /api/v1}
     * @param pool         database pool handed to the route sets
     */
    public WalletRestServer(WalletServiceConfig config,
                            ServiceStatus status,
                            List<HealthCheck> healthChecks,
                            List<? extends ApiRoutes> apiRoutes,
                            Supplier<Pool> pool) {
        this.config = Objects.requireNonNull(config, "config");
        this.status = Objects.requireNonNull(status, "status");
        this.healthChecks = List.copyOf(healthChecks);
        this.apiRoutes = List.copyOf(apiRoutes);
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public void start(Promise<Void> startPromise) {
        Future.succeededFuture()
                .compose(v -> {
                    Router router = createRouter();
                    logger.debug("Router created successfully");
                    return Future.succeededFuture(router);
                })
                .compose(router -> vertx.createHttpServer(new HttpServerOptions()
                                .setHost(config.host())
                                .setPort(config.port()))
                        .requestHandler(router)
                        .listen())
                .compose(httpServer -> {
                    server = httpServer;
                    handle = new ListenerHandle(config.host(), httpServer.actualPort());
                    logger.debug("HTTP server listening on {}", handle.address());
                    return Future.<Void>succeededFuture();
                })
                .onSuccess(v -> startPromise.complete())
                .onFailure(cause -> {
                    logger.debug("HTTP server failed to bind {}:{}", config.host(), config.port(), cause);
                    startPromise.fail(cause);
                });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (server == null) {
            stopPromise.complete();
            return;
        }
        long timeoutMs = config.shutdownTimeout().toMillis();
        logger.debug("Shutting down HTTP server, draining for up to {} ms", timeoutMs);
        server.shutdown(timeoutMs, TimeUnit.MILLISECONDS)
                .onSuccess(v -> {
                    logger.debug("HTTP server stopped");
                    stopPromise.complete();
                })
                .onFailure(cause -> {
                    logger.error("Failed to stop HTTP server", cause);
                    stopPromise.fail(cause);
                });
    }

    @Override
    public ListenerHandle listenerHandle() {
        ListenerHandle current = handle;
        if (current == null) {
            throw new IllegalStateException("HTTP server is not listening");
        }
        return current;
    }

    Router createRouter() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create(LoggerFormat.DEFAULT));
        router.route().handler(CSPHandler.create()
                .setDirective("default-src", "'self'")
                .setDirective("base-uri", "'self'")
                .setDirective("font-src", "'self' https: data:")
                .setDirective("form-action", "'self'")
                .setDirective("frame-ancestors", "'self'")
                .setDirective("img-src", "'self' data:")
                .setDirective("object-src", "'none'")
                .setDirective("script-src", "'self'")
                .setDirective("script-src-attr", "'none'")
                .setDirective("style-src", "'self' https: 'unsafe-inline'"));
        router.route().handler(XFrameHandler.create(XFrameHandler.SAMEORIGIN));
        router.route().handler(HSTSHandler.create(31536000L, true));
        router.route().handler(new SecurityHeadersHandler());
        router.route().handler(createCorsHandler());
        router.route().handler(BodyHandler.create().setBodyLimit(config.bodyLimitBytes()));

        HealthHandler healthHandler = new HealthHandler(config.serviceName(), config.serviceVersion(), status, healthChecks);
        router.get("/health").handler(healthHandler::handleHealth);
        router.get("/health/ready").handler(healthHandler::handleReadiness);

        mountApiRoutes(router);

        router.route().last().handler(new NotFoundHandler());
        router.route().failureHandler(new GlobalErrorHandler(config.exposeErrorStack()));

        return router;
    }

    private void mountApiRoutes(Router router) {
        if (apiRoutes.isEmpty()) {
            logger.warn("No API routes installed; requests under {} will return 404", API_MOUNT_POINT);
            return;
        }
        Router apiRouter = Router.router(vertx);
        ApiContext context = new ApiContext(vertx, config, status, pool);
        for (ApiRoutes routes : apiRoutes) {
            routes.mount(apiRouter, context);
            logger.debug("Mounted API routes {}", routes.getClass().getName());
        }
        router.route(API_MOUNT_POINT + "/*").subRouter(apiRouter);
    }

    /**
     * CORS for the configured origins. Requests from any other origin are served without
     * {@code Access-Control-*} headers and their preflights end with 204.
     */
    private Handler<RoutingContext> createCorsHandler() {
        Set<String> allowed = Set.copyOf(config.allowedOrigins());
        CorsHandler cors = CorsHandler.create()
                .addOrigins(config.allowedOrigins())
                .allowCredentials(true)
                .allowedMethods(Set.of(
                        HttpMethod.GET,
                        HttpMethod.POST,
                        HttpMethod.PUT,
                        HttpMethod.PATCH,
                        HttpMethod.DELETE,
                        HttpMethod.OPTIONS))
                .allowedHeader("Content-Type")
                .allowedHeader("Authorization");

        return ctx -> {
            HttpServerRequest request = ctx.request();
            String origin = request.getHeader(HttpHeaders.ORIGIN);
            if (origin == null || allowed.contains(origin)) {
                cors.handle(ctx);
            } else if (request.method() == HttpMethod.OPTIONS
                    && request.getHeader(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD) != null) {
                logger.debug("Preflight from disallowed origin {} answered without CORS headers", origin);
                ctx.response().setStatusCode(204).end();
            } else {
                ctx.next();
            }
        };
    }
}
