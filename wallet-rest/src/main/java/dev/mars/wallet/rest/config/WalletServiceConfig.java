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

package dev.mars.wallet.rest.config;

import dev.mars.wallet.api.config.ConfigValues;
import dev.mars.wallet.db.config.DatabaseSettings;
import io.vertx.core.json.JsonObject;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable, validated configuration of the wallet service.
 * Parsed once at bootstrap from the merged ConfigRetriever output and injected from there;
 * nothing reads the environment afterwards.
 *
 * @param host                  listen host
 * @param port                  listen port, 0 for an ephemeral port
 * @param environment           {@code NODE_ENV}, e.g. {@code development} or {@code production}
 * @param exposeErrorStack      whether error responses carry the stack trace; only when
 *                              {@code NODE_ENV} is explicitly {@code development}
 * @param serviceName           name reported by {@code /health}
 * @param serviceVersion        version reported by {@code /health}
 * @param defaultWalletProvider provider used when a request names none
 * @param allowedOrigins        CORS origins allowed to call the service with credentials
 * @param bodyLimitBytes        maximum accepted request body
 * @param shutdownTimeout       drain window for in-flight requests on shutdown
 * @param database              PostgreSQL settings
 */
public record WalletServiceConfig(
        String host,
        int port,
        String environment,
        boolean exposeErrorStack,
        String serviceName,
        String serviceVersion,
        String defaultWalletProvider,
        List<String> allowedOrigins,
        long bodyLimitBytes,
        Duration shutdownTimeout,
        DatabaseSettings database) {

    public static final String PORT = "PORT";
    public static final String HOST = "HOST";
    public static final String NODE_ENV = "NODE_ENV";
    public static final String SERVICE_NAME = "SERVICE_NAME";
    public static final String SERVICE_VERSION = "SERVICE_VERSION";
    public static final String DEFAULT_WALLET_PROVIDER = "DEFAULT_WALLET_PROVIDER";
    public static final String CORS_ALLOWED_ORIGINS = "CORS_ALLOWED_ORIGINS";
    public static final String BODY_LIMIT_BYTES = "BODY_LIMIT_BYTES";
    public static final String SHUTDOWN_TIMEOUT_MS = "SHUTDOWN_TIMEOUT_MS";

    public static final int DEFAULT_PORT = 3002;
    public static final String DEFAULT_SERVICE_NAME = "wallet-service";
    public static final long DEFAULT_BODY_LIMIT_BYTES = 10L * 1024 * 1024;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 10_000L;

    static final List<String> PRODUCTION_ORIGINS = List.of("https://yourplatform.com");
    static final List<String> DEVELOPMENT_ORIGINS = List.of(
            "http://localhost:3000",
            "http://localhost:3001",
            "http://localhost:8000");

    public WalletServiceConfig {
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(environment, "environment must not be null");
        Objects.requireNonNull(serviceName, "serviceName must not be null");
        Objects.requireNonNull(serviceVersion, "serviceVersion must not be null");
        Objects.requireNonNull(defaultWalletProvider, "defaultWalletProvider must not be null");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        Objects.requireNonNull(database, "database settings must not be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535, was " + port);
        }
        if (bodyLimitBytes <= 0) {
            throw new IllegalArgumentException("bodyLimitBytes must be positive");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must not be negative");
        }
        if (allowedOrigins == null || allowedOrigins.isEmpty()) {
            throw new IllegalArgumentException("allowedOrigins must be provided and non-empty");
        }
        allowedOrigins = List.copyOf(allowedOrigins);
    }

    /**
     * Parse and validate configuration from the merged ConfigRetriever output.
     *
     * @param json flattened configuration; values may be strings (environment) or JSON types (file)
     * @return validated, immutable configuration
     * @throws IllegalArgumentException if a value is present but invalid
     */
    public static WalletServiceConfig from(JsonObject json) {
        String explicitEnvironment = ConfigValues.getString(json, NODE_ENV, null);
        String environment = explicitEnvironment != null ? explicitEnvironment : "development";
        boolean production = "production".equalsIgnoreCase(environment);

        String originsOverride = ConfigValues.getString(json, CORS_ALLOWED_ORIGINS, null);
        List<String> origins;
        if (originsOverride != null) {
            origins = Arrays.stream(originsOverride.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        } else {
            origins = production ? PRODUCTION_ORIGINS : DEVELOPMENT_ORIGINS;
        }

        long shutdownMs = ConfigValues.getLong(json, SHUTDOWN_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT_MS);
        if (shutdownMs < 0) {
            throw new IllegalArgumentException("Invalid value for " + SHUTDOWN_TIMEOUT_MS + ": must not be negative, was " + shutdownMs);
        }
        int port = ConfigValues.getInt(json, PORT, DEFAULT_PORT);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid value for " + PORT + ": must be 0-65535, was " + port);
        }
        long bodyLimit = ConfigValues.getLong(json, BODY_LIMIT_BYTES, DEFAULT_BODY_LIMIT_BYTES);
        if (bodyLimit <= 0) {
            throw new IllegalArgumentException("Invalid value for " + BODY_LIMIT_BYTES + ": must be positive, was " + bodyLimit);
        }

        return new WalletServiceConfig(
                ConfigValues.getString(json, HOST, "localhost"),
                port,
                environment,
                "development".equals(explicitEnvironment),
                ConfigValues.getString(json, SERVICE_NAME, DEFAULT_SERVICE_NAME),
                ConfigValues.getString(json, SERVICE_VERSION, packagedVersion()),
                ConfigValues.getString(json, DEFAULT_WALLET_PROVIDER, "providus"),
                origins,
                bodyLimit,
                Duration.ofMillis(shutdownMs),
                DatabaseSettings.from(json, production));
    }

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }

    /**
     * Human-readable form of the service name, e.g. {@code Wallet Service}.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : serviceName.split("[-_\\s]+")) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(part.substring(0, 1).toUpperCase(Locale.ROOT)).append(part.substring(1));
        }
        return sb.length() > 0 ? sb.toString() : serviceName;
    }

    private static String packagedVersion() {
        String version = WalletServiceConfig.class.getPackage().getImplementationVersion();
        return version != null ? version : "1.0.0";
    }
}
