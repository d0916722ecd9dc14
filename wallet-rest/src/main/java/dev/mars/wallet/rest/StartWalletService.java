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

import dev.mars.wallet.rest.config.WalletServiceConfig;
import dev.mars.wallet.runtime.ProcessTerminator;
import dev.mars.wallet.runtime.signal.JvmTerminationSignals;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the wallet service.
 *
 * <p>Configuration precedence (highest to lowest):</p>
 * <ol>
 *   <li>System properties ({@code -DPORT=3003})</li>
 *   <li>Environment variables ({@code PORT=3003})</li>
 *   <li>Config file ({@code conf/wallet-service.json}, optional)</li>
 *   <li>Defaults (in {@link WalletServiceConfig})</li>
 * </ol>
 *
 * <pre>
 * mvn exec:java -pl wallet-rest
 * </pre>
 *
 * <p>Exits with status 1 when configuration is invalid or startup fails, and with status 0
 * after a graceful shutdown on SIGINT or SIGTERM.</p>
 */
public final class StartWalletService {
    private static final Logger logger = LoggerFactory.getLogger(StartWalletService.class);

    static final String CONFIG_FILE = "conf/wallet-service.json";

    private StartWalletService() {
        // Utility class - not instantiable
    }

    public static void main(String[] args) {
        Vertx vertx = Vertx.vertx();
        ProcessTerminator terminator = ProcessTerminator.jvm();

        ConfigRetriever retriever = ConfigRetriever.create(vertx, retrieverOptions());
        retriever.getConfig().onComplete(ar -> {
            if (ar.failed()) {
                logger.error("Failed to load configuration", ar.cause());
                terminator.exit(1);
                return;
            }

            WalletServiceConfig config;
            try {
                config = WalletServiceConfig.from(ar.result());
            } catch (IllegalArgumentException e) {
                logger.error("Invalid configuration: {}", e.getMessage());
                terminator.exit(1);
                return;
            }
            logger.debug("Configuration loaded: host={}, port={}, environment={}",
                config.host(), config.port(), config.environment());

            WalletService service = WalletService.create(vertx, config, terminator);
            service.lifecycle().registerSignalHandlers(new JvmTerminationSignals());
            // Exit codes for failed starts are handled by the lifecycle manager
            service.start();
        });
    }

    static ConfigRetrieverOptions retrieverOptions() {
        ConfigStoreOptions fileStore = new ConfigStoreOptions()
            .setType("file")
            .setOptional(true)
            .setConfig(new JsonObject().put("path", CONFIG_FILE));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
            .setType("env")
            .setConfig(new JsonObject().put("raw-data", true));

        ConfigStoreOptions sysPropsStore = new ConfigStoreOptions()
            .setType("sys")
            .setConfig(new JsonObject().put("cache", false));

        return new ConfigRetrieverOptions()
            .addStore(fileStore)       // Lowest priority
            .addStore(envStore)        // Middle priority
            .addStore(sysPropsStore)   // Highest priority
            .setScanPeriod(-1);
    }
}
