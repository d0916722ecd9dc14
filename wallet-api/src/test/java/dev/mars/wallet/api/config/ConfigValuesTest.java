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

package dev.mars.wallet.api.config;

import dev.mars.wallet.test.categories.TestCategories;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class ConfigValuesTest {

    @Test
    @DisplayName("numbers parse from both JSON numbers and strings")
    void testIntegerParsing() {
        JsonObject config = new JsonObject()
            .put("FROM_FILE", 3002)
            .put("FROM_ENV", " 8080 ");

        assertEquals(3002, ConfigValues.getInt(config, "FROM_FILE", 1));
        assertEquals(8080, ConfigValues.getInt(config, "FROM_ENV", 1));
        assertEquals(42, ConfigValues.getInt(config, "MISSING", 42));
    }

    @Test
    void testBlankFallsBackToDefault() {
        JsonObject config = new JsonObject().put("PORT", "").put("HOST", "   ");

        assertEquals(3002, ConfigValues.getInt(config, "PORT", 3002));
        assertEquals("localhost", ConfigValues.getString(config, "HOST", "localhost"));
    }

    @Test
    void testInvalidIntegerNamesKey() {
        JsonObject config = new JsonObject().put("PORT", "abc");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ConfigValues.getInt(config, "PORT", 3002));
        assertTrue(e.getMessage().contains("PORT"));
    }

    @Test
    void testFractionalNumberRejected() {
        JsonObject config = new JsonObject().put("DB_POOL_MAX", 2.5);

        assertThrows(IllegalArgumentException.class, () -> ConfigValues.getInt(config, "DB_POOL_MAX", 20));
    }

    @Test
    void testBooleanParsing() {
        JsonObject config = new JsonObject()
            .put("A", true)
            .put("B", "FALSE")
            .put("C", "yes");

        assertTrue(ConfigValues.getBoolean(config, "A", false));
        assertFalse(ConfigValues.getBoolean(config, "B", true));
        assertTrue(ConfigValues.getBoolean(config, "MISSING", true));
        assertThrows(IllegalArgumentException.class, () -> ConfigValues.getBoolean(config, "C", false));
    }
}
