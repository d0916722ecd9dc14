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

import io.vertx.core.json.JsonObject;

/**
 * Typed reads over a flattened configuration object.
 *
 * <p>The environment store delivers every value as a string while file stores
 * deliver JSON numbers and booleans, so each accessor accepts both. A present
 * but unparseable value fails with {@link IllegalArgumentException} naming the key.</p>
 */
public final class ConfigValues {

    private ConfigValues() {
        // Utility class - no instantiation
    }

    /**
     * Returns the trimmed string value, or the default when the key is missing or blank.
     */
    public static String getString(JsonObject config, String key, String defaultValue) {
        Object raw = config.getValue(key);
        if (raw == null) {
            return defaultValue;
        }
        String value = raw.toString().trim();
        return value.isEmpty() ? defaultValue : value;
    }

    public static int getInt(JsonObject config, String key, int defaultValue) {
        long value = getLong(config, key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value + " is out of range");
        }
        return (int) value;
    }

    public static long getLong(JsonObject config, String key, long defaultValue) {
        Object raw = config.getValue(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Number) {
            Number number = (Number) raw;
            if (number.doubleValue() != number.longValue()) {
                throw new IllegalArgumentException("Invalid value for " + key + ": expected an integer but was " + raw);
            }
            return number.longValue();
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": expected an integer but was '" + text + "'", e);
        }
    }

    public static boolean getBoolean(JsonObject config, String key, boolean defaultValue) {
        Object raw = config.getValue(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": expected true or false but was '" + text + "'");
    }
}
