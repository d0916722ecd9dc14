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

package dev.mars.wallet.db.connection;

import dev.mars.wallet.api.health.HealthCheck;
import dev.mars.wallet.api.init.InitializationStep;
import dev.mars.wallet.db.config.DatabaseSettings;
import dev.mars.wallet.db.config.PgConnectionConfig;
import dev.mars.wallet.db.config.PgPoolConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.net.ClientSSLOptions;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The PostgreSQL dependency of the wallet service.
 *
 * <p>As an {@link InitializationStep} it builds the reactive pool and proves connectivity with
 * {@code SELECT NOW()} before the HTTP listener is allowed to bind. Wallet queries are issued
 * by route collaborators through {@link #pool()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class WalletDatabase implements InitializationStep {
    private static final Logger logger = LoggerFactory.getLogger(WalletDatabase.class);

    public static final String STEP_NAME = "database";

    private final Vertx vertx;
    private final PgConnectionConfig connectionConfig;
    private final PgPoolConfig poolConfig;
    private final MeterRegistry meter;
    private final AtomicReference<Pool> pool = new AtomicReference<>();

    public WalletDatabase(Vertx vertx, DatabaseSettings settings) {
        this(vertx, settings, null);
    }

    public WalletDatabase(Vertx vertx, DatabaseSettings settings, MeterRegistry meter) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        Objects.requireNonNull(settings, "settings");
        this.connectionConfig = settings.connection();
        this.poolConfig = settings.pool();
        this.meter = meter;
    }

    @Override
    public String name() {
        return STEP_NAME;
    }

    @Override
    public Future<Void> initialize() {
        if (pool.get() != null) {
            return Future.failedFuture(new IllegalStateException("Database already initialized"));
        }

        Pool created;
        try {
            created = createReactivePool();
        } catch (Exception e) {
            logger.error("Failed to create pool for {}: {}", connectionConfig.describeTarget(), e.getMessage());
            increment("wallet.db.pool.connect.failed");
            return Future.failedFuture(e);
        }

        return created.query("SELECT NOW()").execute()
            .compose(rows -> {
                if (!pool.compareAndSet(null, created)) {
                    return created.close()
                        .transform(ar -> Future.<Void>failedFuture(
                            new IllegalStateException("Database already initialized")));
                }
                increment("wallet.db.pool.created");
                logger.info("Database connection established successfully ({})", connectionConfig.describeTarget());
                return Future.<Void>succeededFuture();
            }, err -> {
                logger.error("Database connection failed ({}): {}", connectionConfig.describeTarget(), err.getMessage());
                increment("wallet.db.pool.connect.failed");
                // The pool may hold a half-open connection; release it and keep the original cause
                return created.close().transform(ar -> Future.<Void>failedFuture(err));
            });
    }

    /**
     * @return the initialized pool
     * @throws IllegalStateException if {@link #initialize()} has not completed successfully
     */
    public Pool pool() {
        Pool current = pool.get();
        if (current == null) {
            throw new IllegalStateException("Database not initialized");
        }
        return current;
    }

    public boolean isInitialized() {
        return pool.get() != null;
    }

    /**
     * Checks the database with {@code SELECT 1}.
     *
     * @return future completing with true when healthy, false otherwise; never fails
     */
    public Future<Boolean> checkHealth() {
        Pool current = pool.get();
        if (current == null) {
            return Future.succeededFuture(false);
        }
        return current.withConnection(conn -> conn.query("SELECT 1").execute().map(rs -> true))
            .recover(err -> {
                logger.warn("Database health check failed: {}", err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    /**
     * Exposes {@link #checkHealth()} for readiness reporting.
     */
    public HealthCheck healthCheck() {
        return new HealthCheck() {
            @Override
            public String name() {
                return STEP_NAME;
            }

            @Override
            public Future<Boolean> check() {
                return checkHealth();
            }
        };
    }

    @Override
    public Future<Void> close() {
        Pool current = pool.getAndSet(null);
        if (current == null) {
            logger.debug("No database pool to close");
            return Future.succeededFuture();
        }
        return current.close()
            .onSuccess(v -> {
                logger.info("Database connection closed");
                increment("wallet.db.pool.closed");
            })
            .onFailure(err -> logger.warn("Failed to close database pool: {}", err.getMessage()));
    }

    private Pool createReactivePool() {
        PgConnectOptions connectOptions;
        if (connectionConfig.hasUri()) {
            connectOptions = PgConnectOptions.fromUri(connectionConfig.getUri());
        } else {
            connectOptions = new PgConnectOptions()
                .setHost(connectionConfig.getHost())
                .setPort(connectionConfig.getPort())
                .setDatabase(connectionConfig.getDatabase())
                .setUser(connectionConfig.getUsername())
                .setPassword(connectionConfig.getPassword() == null ? "" : connectionConfig.getPassword());
        }

        if (connectionConfig.isSslEnabled()) {
            // Encrypted without certificate verification
            connectOptions.setSslMode(SslMode.REQUIRE)
                .setSslOptions(new ClientSSLOptions().setTrustAll(true));
        } else {
            connectOptions.setSslMode(SslMode.DISABLE);
        }

        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(poolConfig.getMaxSize())
            .setMaxWaitQueueSize(poolConfig.getMaxWaitQueueSize())
            .setConnectionTimeout(Math.toIntExact(poolConfig.getConnectionTimeout().toMillis()))
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout(Math.toIntExact(poolConfig.getIdleTimeout().toMillis()))
            .setIdleTimeoutUnit(TimeUnit.MILLISECONDS);

        Pool created = PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();

        logger.info("Created Vert.x reactive pool for {} (maxSize={})",
            connectionConfig.describeTarget(), poolConfig.getMaxSize());
        return created;
    }

    private void increment(String counterName) {
        if (meter != null) {
            Counter.builder(counterName)
                .tag("service", "wallet-service")
                .register(meter)
                .increment();
        }
    }
}
