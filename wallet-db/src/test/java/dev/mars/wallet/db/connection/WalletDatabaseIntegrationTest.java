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

import dev.mars.wallet.db.config.DatabaseSettings;
import dev.mars.wallet.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs {@link WalletDatabase} against a real PostgreSQL container.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
@ExtendWith(VertxExtension.class)
class WalletDatabaseIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15.13-alpine3.20")
        .withDatabaseName("wallet_test")
        .withUsername("wallet_test")
        .withPassword("wallet_test");

    @Test
    void testInitializeHealthAndClose(Vertx vertx, VertxTestContext testContext) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        WalletDatabase database = new WalletDatabase(vertx, DatabaseSettings.from(discreteConfig(), false), registry);

        database.initialize()
            .compose(v -> {
                testContext.verify(() -> assertTrue(database.isInitialized()));
                return database.checkHealth();
            })
            .compose(healthy -> {
                testContext.verify(() -> assertTrue(healthy));
                return database.pool().query("SELECT current_database()").execute();
            })
            .compose(rows -> {
                testContext.verify(() -> assertEquals("wallet_test", rows.iterator().next().getString(0)));
                return database.close();
            })
            .compose(v -> database.checkHealth())
            .onComplete(testContext.succeeding(healthyAfterClose -> testContext.verify(() -> {
                assertFalse(healthyAfterClose);
                assertThrows(IllegalStateException.class, database::pool);
                assertEquals(1.0, registry.get("wallet.db.pool.created").counter().count());
                assertEquals(1.0, registry.get("wallet.db.pool.closed").counter().count());
                testContext.completeNow();
            })));
    }

    @Test
    void testInitializeFromDatabaseUrl(Vertx vertx, VertxTestContext testContext) {
        String url = "postgresql://" + postgres.getUsername() + ":" + postgres.getPassword() + "@"
            + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + postgres.getDatabaseName();
        WalletDatabase database = new WalletDatabase(vertx,
            DatabaseSettings.from(new JsonObject().put("DATABASE_URL", url), false));

        database.initialize()
            .compose(v -> database.checkHealth())
            .compose(healthy -> {
                testContext.verify(() -> assertTrue(healthy));
                return database.close();
            })
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    void testWrongPasswordFailsInitialization(Vertx vertx, VertxTestContext testContext) {
        JsonObject config = discreteConfig().put("DB_PASSWORD", "not-the-password");
        WalletDatabase database = new WalletDatabase(vertx, DatabaseSettings.from(config, false));

        database.initialize().onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertFalse(database.isInitialized());
            testContext.completeNow();
        })));
    }

    private static JsonObject discreteConfig() {
        return new JsonObject()
            .put("DB_HOST", postgres.getHost())
            .put("DB_PORT", postgres.getFirstMappedPort())
            .put("DB_NAME", postgres.getDatabaseName())
            .put("DB_USER", postgres.getUsername())
            .put("DB_PASSWORD", postgres.getPassword())
            .put("DB_POOL_MAX", 4);
    }
}
