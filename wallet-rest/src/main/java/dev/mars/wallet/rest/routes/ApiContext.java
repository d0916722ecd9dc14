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

package dev.mars.wallet.rest.routes;

import dev.mars.wallet.api.lifecycle.ServiceStatus;
import dev.mars.wallet.rest.config.WalletServiceConfig;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * What a route set may use while mounting and serving requests.
 *
 * @param vertx  the Vert.x instance of the listener verticle
 * @param config service configuration
 * @param status read-only lifecycle view
 * @param pool   supplies the database pool; throws {@link IllegalStateException} before initialization
 */
public record ApiContext(Vertx vertx, WalletServiceConfig config, ServiceStatus status, Supplier<Pool> pool) {

    public ApiContext {
        Objects.requireNonNull(vertx, "vertx");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(pool, "pool");
    }
}
