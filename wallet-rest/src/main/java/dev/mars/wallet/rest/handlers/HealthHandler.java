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

package dev.mars.wallet.rest.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.wallet.api.health.HealthCheck;
import dev.mars.wallet.api.lifecycle.ServiceStatus;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Liveness and readiness endpoints.
 *
 * <p>{@code GET /health} answers whenever the listener is bound. {@code GET /health/ready}
 * answers 200 only while the service is {@code READY} and every registered check passes,
 * and 503 otherwise, including during shutdown.</p>
 */
public class HealthHandler {
    private static final Logger logger = LoggerFactory.getLogger(HealthHandler.class);

    private final String serviceName;
    private final String serviceVersion;
    private final ServiceStatus status;
    private final List<HealthCheck> checks;
    private final ObjectMapper objectMapper;

    public HealthHandler(String serviceName, String serviceVersion, ServiceStatus status, List<HealthCheck> checks) {
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        this.serviceVersion = Objects.requireNonNull(serviceVersion, "serviceVersion");
        this.status = Objects.requireNonNull(status, "status");
        this.checks = List.copyOf(checks);
        this.objectMapper = createObjectMapper();
    }

    /**
     * Body of {@code GET /health}.
     */
    public record HealthResponse(String status, String service, String version, Instant timestamp) {
    }

    public void handleHealth(RoutingContext ctx) {
        HealthResponse body = new HealthResponse("healthy", serviceName, serviceVersion, Instant.now());
        try {
            ctx.response()
                .setStatusCode(200)
                .putHeader("Content-Type", "application/json")
                .end(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            ctx.fail(500, e);
        }
    }

    public void handleReadiness(RoutingContext ctx) {
        List<Future<Boolean>> results = new ArrayList<>(checks.size());
        for (HealthCheck check : checks) {
            results.add(runCheck(check));
        }

        Future.join(results).onComplete(ar -> {
            JsonObject details = new JsonObject();
            boolean allUp = true;
            for (int i = 0; i < checks.size(); i++) {
                Future<Boolean> result = results.get(i);
                boolean up = result.succeeded() && Boolean.TRUE.equals(result.result());
                details.put(checks.get(i).name(), up ? "UP" : "DOWN");
                allUp &= up;
            }

            boolean ready = status.isReady() && allUp;
            JsonObject body = new JsonObject()
                .put("status", ready ? "ready" : "not_ready")
                .put("state", status.state().name())
                .put("checks", details);

            ctx.response()
                .setStatusCode(ready ? 200 : 503)
                .putHeader("Content-Type", "application/json")
                .end(body.encode());
        });
    }

    private Future<Boolean> runCheck(HealthCheck check) {
        try {
            return check.check().recover(err -> {
                logger.warn("Health check '{}' failed: {}", check.name(), err.getMessage());
                return Future.succeededFuture(false);
            });
        } catch (RuntimeException e) {
            logger.warn("Health check '{}' threw: {}", check.name(), e.getMessage());
            return Future.succeededFuture(false);
        }
    }

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
