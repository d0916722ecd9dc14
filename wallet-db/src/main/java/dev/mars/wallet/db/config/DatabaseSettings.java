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

package dev.mars.wallet.db.config;

import dev.mars.wallet.api.config.ConfigValues;
import io.vertx.core.json.JsonObject;

import java.time.Duration;
import java.util.Objects;

/**
 * Database settings of the wallet service, parsed from the flattened bootstrap configuration.
 *
 * <p>{@code DATABASE_URL} takes precedence over the discrete {@code DB_*} keys. SSL defaults
 * to on in production and off elsewhere; {@code DB_SSL} overrides either.</p>
 *
 * @param connection connection target and credentials
 * @param pool       pool sizing and timeouts
 */
public record DatabaseSettings(PgConnectionConfig connection, PgPoolConfig pool) {

    public static final String DATABASE_URL = "DATABASE_URL";
    public static final String DB_HOST = "DB_HOST";
    public static final String DB_PORT = "DB_PORT";
    public static final String DB_NAME = "DB_NAME";
    public static final String DB_USER = "DB_USER";
    public static final String DB_PASSWORD = "DB_PASSWORD";
    public static final String DB_POOL_MAX = "DB_POOL_MAX";
    public static final String DB_IDLE_TIMEOUT_MS = "DB_IDLE_TIMEOUT_MS";
    public static final String DB_CONNECT_TIMEOUT_MS = "DB_CONNECT_TIMEOUT_MS";
    public static final String DB_SSL = "DB_SSL";

    public DatabaseSettings {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(pool, "pool");
    }

    /**
     * Parses the {@code DB_*} keys.
     *
     * @param config     flattened configuration (environment, system properties, file)
     * @param production whether the service runs with {@code NODE_ENV=production}
     * @throws IllegalArgumentException if a value is present but invalid
     */
    public static DatabaseSettings from(JsonObject config, boolean production) {
        Objects.requireNonNull(config, "config");

        int poolMax = ConfigValues.getInt(config, DB_POOL_MAX, 20);
        long idleMs = ConfigValues.getLong(config, DB_IDLE_TIMEOUT_MS, 30_000L);
        long connectMs = ConfigValues.getLong(config, DB_CONNECT_TIMEOUT_MS, 2_000L);
        if (poolMax <= 0) {
            throw new IllegalArgumentException("Invalid value for " + DB_POOL_MAX + ": must be positive, was " + poolMax);
        }
        if (idleMs < 0 || idleMs > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid value for " + DB_IDLE_TIMEOUT_MS + ": must be 0-" + Integer.MAX_VALUE + ", was " + idleMs);
        }
        if (connectMs <= 0 || connectMs > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid value for " + DB_CONNECT_TIMEOUT_MS + ": must be 1-" + Integer.MAX_VALUE + ", was " + connectMs);
        }

        int port = ConfigValues.getInt(config, DB_PORT, 5432);
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid value for " + DB_PORT + ": must be 1-65535, was " + port);
        }

        PgConnectionConfig connection = new PgConnectionConfig.Builder()
            .uri(ConfigValues.getString(config, DATABASE_URL, null))
            .host(ConfigValues.getString(config, DB_HOST, "localhost"))
            .port(port)
            .database(ConfigValues.getString(config, DB_NAME, "wallet"))
            .username(ConfigValues.getString(config, DB_USER, "wallet"))
            .password(ConfigValues.getString(config, DB_PASSWORD, ""))
            .sslEnabled(ConfigValues.getBoolean(config, DB_SSL, production))
            .build();

        PgPoolConfig pool = new PgPoolConfig.Builder()
            .maxSize(poolMax)
            .idleTimeout(Duration.ofMillis(idleMs))
            .connectionTimeout(Duration.ofMillis(connectMs))
            .build();

        return new DatabaseSettings(connection, pool);
    }
}
