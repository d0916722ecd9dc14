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
import dev.mars.wallet.api.init.InitializationStep;
import dev.mars.wallet.api.lifecycle.ListenerHandle;
import dev.mars.wallet.db.connection.WalletDatabase;
import dev.mars.wallet.rest.config.WalletServiceConfig;
import dev.mars.wallet.rest.routes.ApiRoutes;
import dev.mars.wallet.runtime.DependencyInitializer;
import dev.mars.wallet.runtime.LifecycleOptions;
import dev.mars.wallet.runtime.ProcessTerminator;
import dev.mars.wallet.runtime.ServiceLifecycleManager;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Wires configuration, dependencies, the HTTP listener and the lifecycle manager together.
 */
public final class WalletService {
    private static final Logger logger = LoggerFactory.getLogger(WalletService.class);

    private final WalletServiceConfig config;
    private final ServiceLifecycleManager lifecycle;

    /**
     * Production wiring: PostgreSQL as the single dependency and the route sets found on the class path.
     */
    public static WalletService create(Vertx vertx, WalletServiceConfig config, ProcessTerminator terminator) {
        WalletDatabase database = new WalletDatabase(vertx, config.database());
        return new WalletService(vertx, config,
            List.of(database),
            List.of(database.healthCheck()),
            ApiRoutes.discover(),
            database::pool,
            terminator);
    }

    public WalletService(Vertx vertx,
                         WalletServiceConfig config,
                         List<? extends InitializationStep> steps,
                         List<HealthCheck> healthChecks,
                         List<? extends ApiRoutes> apiRoutes,
                         Supplier<Pool> pool,
                         ProcessTerminator terminator) {
        this.config = Objects.requireNonNull(config, "config");
        LifecycleOptions options = new LifecycleOptions(config.displayName(), config.shutdownTimeout());
        this.lifecycle = new ServiceLifecycleManager(vertx, options, new DependencyInitializer(steps),
            () -> new WalletRestServer(config, lifecycle(), healthChecks, apiRoutes, pool),
            terminator);
    }

    /**
     * Initializes dependencies and binds the listener.
     */
    public Future<ListenerHandle> start() {
        return lifecycle.start().onSuccess(handle -> {
            logger.info("Environment: {}", config.environment());
            logger.info("Default Provider: {}", config.defaultWalletProvider());
        });
    }

    public ServiceLifecycleManager lifecycle() {
        return lifecycle;
    }

    public WalletServiceConfig config() {
        return config;
    }
}
