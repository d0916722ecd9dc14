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

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing and timeouts of the reactive connection pool.
 */
public final class PgPoolConfig {
    private final int maxSize;
    private final int maxWaitQueueSize;
    private final Duration connectionTimeout;
    private final Duration idleTimeout;

    private PgPoolConfig(Builder builder) {
        if (builder.maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (builder.connectionTimeout.isNegative() || builder.connectionTimeout.isZero()) {
            throw new IllegalArgumentException("connectionTimeout must be positive");
        }
        // PoolOptions takes int milliseconds
        if (builder.connectionTimeout.toMillis() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("connectionTimeout must not exceed " + Integer.MAX_VALUE + " ms");
        }
        if (builder.idleTimeout.isNegative() || builder.idleTimeout.toMillis() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("idleTimeout must be 0-" + Integer.MAX_VALUE + " ms");
        }
        this.maxSize = builder.maxSize;
        this.maxWaitQueueSize = builder.maxWaitQueueSize;
        this.connectionTimeout = builder.connectionTimeout;
        this.idleTimeout = builder.idleTimeout;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getMaxWaitQueueSize() {
        return maxWaitQueueSize;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    @Override
    public String toString() {
        return "PgPoolConfig{" +
            "maxSize=" + maxSize +
            ", maxWaitQueueSize=" + maxWaitQueueSize +
            ", connectionTimeout=" + connectionTimeout +
            ", idleTimeout=" + idleTimeout +
            '}';
    }

    public static final class Builder {
        private int maxSize = 20;
        private int maxWaitQueueSize = 128; // Prevent memory exhaustion under backpressure
        private Duration connectionTimeout = Duration.ofSeconds(2);
        private Duration idleTimeout = Duration.ofSeconds(30);

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder maxWaitQueueSize(int maxWaitQueueSize) {
            this.maxWaitQueueSize = maxWaitQueueSize;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "connectionTimeout");
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
            return this;
        }

        public PgPoolConfig build() {
            return new PgPoolConfig(this);
        }
    }
}
