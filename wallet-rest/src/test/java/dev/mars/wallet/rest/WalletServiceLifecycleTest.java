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

import dev.mars.wallet.api.init.InitializationStep;
import dev.mars.wallet.api.lifecycle.ListenerHandle;
import dev.mars.wallet.api.lifecycle.ServiceState;
import dev.mars.wallet.rest.config.WalletServiceConfig;
import dev.mars.wallet.rest.routes.ApiRoutes;
import dev.mars.wallet.rest.support.CapturingAppender;
import dev.mars.wallet.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full startup and shutdown of the wallet service with a real HTTP listener and a stand-in dependency.
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class WalletServiceLifecycleTest {

    private final List<Integer> exits = new CopyOnWriteArrayList<>();
    private CapturingAppender logs;
    private WebClient client;

    @BeforeEach
    void setUp(Vertx vertx) {
        logs = CapturingAppender.attach();
        client = WebClient.create(vertx);
    }

    @AfterEach
    void tearDown() {
        client.close();
        logs.detach();
    }

    /**
     * Dependency whose initialization completes when the test says so.
     */
    static final class GatedStep implements InitializationStep {
        final Promise<Void> gate = Promise.promise();
        final List<String> events = new CopyOnWriteArrayList<>();

        @Override
        public String name() {
            return "database";
        }

        @Override
        public Future<Void> initialize() {
            events.add("init");
            return gate.future();
        }

        @Override
        public Future<Void> close() {
            events.add("close");
            return Future.succeededFuture();
        }
    }

    private WalletService service(Vertx vertx, int port, InitializationStep step, List<ApiRoutes> routes) {
        WalletServiceConfig config = WalletServiceConfig.from(new JsonObject()
            .put("PORT", port)
            .put("SHUTDOWN_TIMEOUT_MS", 5000));
        return new WalletService(vertx, config, List.of(step), List.of(), routes,
            () -> {
                throw new IllegalStateException("no database in this test");
            },
            exits::add);
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    @Test
    @DisplayName("failed initialization exits with 1 and never opens the port")
    void testInitializationFailure(Vertx vertx, VertxTestContext testContext) throws IOException {
        int port = freePort();
        GatedStep step = new GatedStep();
        WalletService service = service(vertx, port, step, List.of());

        service.start().onComplete(testContext.failing(err -> { }));
        step.gate.fail(new IllegalStateException("connection refused"));

        service.lifecycle().terminated()
            .compose(status -> {
                testContext.verify(() -> {
                    assertEquals(1, status);
                    assertEquals(List.of(1), exits);
                    assertEquals(ServiceState.STOPPED, service.lifecycle().state());
                    assertEquals(0, logs.count("running on"));
                    assertEquals(1, logs.count("Failed to initialize services"));
                });
                return client.get(port, "localhost", "/health").send();
            })
            .onComplete(testContext.failing(err -> testContext.completeNow()));
    }

    @Test
    @DisplayName("the port stays closed until initialization completes")
    void testNoTrafficBeforeReady(Vertx vertx, VertxTestContext testContext) throws IOException {
        int port = freePort();
        GatedStep step = new GatedStep();
        WalletService service = service(vertx, port, step, List.of());

        Future<ListenerHandle> started = service.start();

        client.get(port, "localhost", "/health").send()
            .transform(early -> {
                testContext.verify(() -> {
                    assertTrue(early.failed(), "listener must not accept before dependencies are up");
                    assertEquals(ServiceState.INITIALIZING, service.lifecycle().state());
                });
                step.gate.complete();
                return started;
            })
            .compose(handle -> client.get(port, "localhost", "/health").send())
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                assertEquals(200, response.statusCode());
                assertEquals("wallet-service", response.bodyAsJsonObject().getString("service"));
                assertTrue(logs.messages().contains("Wallet Service running on localhost:" + port));
                assertTrue(logs.messages().contains("Environment: development"));
                assertTrue(logs.messages().contains("Default Provider: providus"));
                assertTrue(exits.isEmpty());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("SIGINT after startup closes the server and exits with 0")
    void testSigintShutdown(Vertx vertx, VertxTestContext testContext) {
        GatedStep step = new GatedStep();
        step.gate.complete();
        WalletService service = service(vertx, 0, step, List.of());

        service.start().onComplete(testContext.succeeding(handle -> service.lifecycle().onTerminationSignal("SIGINT")));

        service.lifecycle().terminated().onComplete(testContext.succeeding(status -> testContext.verify(() -> {
            assertEquals(0, status);
            assertEquals(List.of(0), exits);
            int received = logs.indexOf("Received SIGINT. Shutting down gracefully...");
            int closed = logs.indexOf("Server closed");
            assertTrue(received >= 0);
            assertTrue(closed > received);
            assertEquals(List.of("init", "close"), step.events);
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("an in-flight request completes during shutdown and new connections are refused")
    void testInFlightRequestDrains(Vertx vertx, VertxTestContext testContext) {
        GatedStep step = new GatedStep();
        step.gate.complete();
        Promise<Void> requestArrived = Promise.promise();
        ApiRoutes slowRoutes = (router, context) -> router.get("/slow").handler(ctx -> {
            requestArrived.tryComplete();
            context.vertx().setTimer(500, t -> ctx.json(new JsonObject().put("done", true)));
        });
        WalletService service = service(vertx, 0, step, List.of(slowRoutes));

        service.start().onComplete(testContext.succeeding(handle -> {
            Future<Integer> slowStatus = client.get(handle.port(), "localhost", "/api/v1/slow").send()
                .map(response -> response.statusCode());

            requestArrived.future().onSuccess(v -> service.lifecycle().onTerminationSignal("SIGTERM"));

            Future.all(slowStatus, service.lifecycle().terminated())
                .compose(all -> {
                    testContext.verify(() -> {
                        assertEquals(200, slowStatus.result());
                        assertEquals(0, service.lifecycle().terminated().result());
                    });
                    WebClient fresh = WebClient.create(vertx);
                    return fresh.get(handle.port(), "localhost", "/health").send()
                        .onComplete(ar -> fresh.close());
                })
                .onComplete(testContext.failing(err -> testContext.completeNow()));
        }));
    }
}
