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

import dev.mars.wallet.test.categories.TestCategories;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parsing, defaults and validation of {@link WalletServiceConfig}.
 */
@Tag(TestCategories.CORE)
class WalletServiceConfigTest {

    @Test
    @DisplayName("empty configuration yields development defaults")
    void testDefaults() {
        WalletServiceConfig config = WalletServiceConfig.from(new JsonObject());

        assertEquals("localhost", config.host());
        assertEquals(3002, config.port());
        assertEquals("development", config.environment());
        assertFalse(config.isProduction());
        assertFalse(config.exposeErrorStack(), "an unset NODE_ENV must not expose stacks");
        assertEquals("wallet-service", config.serviceName());
        assertEquals("Wallet Service", config.displayName());
        assertNotNull(config.serviceVersion());
        assertEquals("providus", config.defaultWalletProvider());
        assertEquals(List.of("http://localhost:3000", "http://localhost:3001", "http://localhost:8000"),
            config.allowedOrigins());
        assertEquals(10L * 1024 * 1024, config.bodyLimitBytes());
        assertEquals(Duration.ofSeconds(10), config.shutdownTimeout());
        assertFalse(config.database().connection().isSslEnabled());
    }

    @Test
    @DisplayName("error stacks are exposed only for an explicit development environment")
    void testErrorStackExposure() {
        assertTrue(WalletServiceConfig.from(new JsonObject().put("NODE_ENV", "development")).exposeErrorStack());
        assertFalse(WalletServiceConfig.from(new JsonObject().put("NODE_ENV", "production")).exposeErrorStack());
        assertFalse(WalletServiceConfig.from(new JsonObject().put("NODE_ENV", "staging")).exposeErrorStack());
    }

    @Test
    void testProductionOrigins() {
        WalletServiceConfig config = WalletServiceConfig.from(new JsonObject().put("NODE_ENV", "production"));

        assertTrue(config.isProduction());
        assertEquals(List.of("https://yourplatform.com"), config.allowedOrigins());
        assertTrue(config.database().connection().isSslEnabled());
    }

    @Test
    void testOriginsOverride() {
        WalletServiceConfig config = WalletServiceConfig.from(new JsonObject()
            .put("NODE_ENV", "production")
            .put("CORS_ALLOWED_ORIGINS", "https://a.example, https://b.example ,"));

        assertEquals(List.of("https://a.example", "https://b.example"), config.allowedOrigins());
    }

    @Test
    @DisplayName("environment strings and file numbers both parse")
    void testStringAndNumberValues() {
        WalletServiceConfig fromEnv = WalletServiceConfig.from(new JsonObject()
            .put("PORT", "3010")
            .put("SHUTDOWN_TIMEOUT_MS", "2500")
            .put("BODY_LIMIT_BYTES", "2048")
            .put("SERVICE_VERSION", "2.3.1"));
        WalletServiceConfig fromFile = WalletServiceConfig.from(new JsonObject()
            .put("PORT", 3010)
            .put("SHUTDOWN_TIMEOUT_MS", 2500)
            .put("BODY_LIMIT_BYTES", 2048));

        assertEquals(3010, fromEnv.port());
        assertEquals(3010, fromFile.port());
        assertEquals(Duration.ofMillis(2500), fromEnv.shutdownTimeout());
        assertEquals(fromEnv.shutdownTimeout(), fromFile.shutdownTimeout());
        assertEquals(2048, fromFile.bodyLimitBytes());
        assertEquals("2.3.1", fromEnv.serviceVersion());
    }

    @Test
    void testEphemeralPortAllowed() {
        assertEquals(0, WalletServiceConfig.from(new JsonObject().put("PORT", 0)).port());
    }

    @Test
    void testInvalidValuesFailFast() {
        IllegalArgumentException badPort = assertThrows(IllegalArgumentException.class,
            () -> WalletServiceConfig.from(new JsonObject().put("PORT", "not-a-port")));
        assertTrue(badPort.getMessage().contains("PORT"));

        assertThrows(IllegalArgumentException.class,
            () -> WalletServiceConfig.from(new JsonObject().put("PORT", 70000)));
        assertThrows(IllegalArgumentException.class,
            () -> WalletServiceConfig.from(new JsonObject().put("SHUTDOWN_TIMEOUT_MS", -1)));
        assertThrows(IllegalArgumentException.class,
            () -> WalletServiceConfig.from(new JsonObject().put("BODY_LIMIT_BYTES", 0)));
        assertThrows(IllegalArgumentException.class,
            () -> WalletServiceConfig.from(new JsonObject().put("CORS_ALLOWED_ORIGINS", " , ")));
    }

    @Test
    void testDisplayNameFromCustomServiceName() {
        WalletServiceConfig config = WalletServiceConfig.from(new JsonObject().put("SERVICE_NAME", "ledger_service"));

        assertEquals("Ledger Service", config.displayName());
    }
}
