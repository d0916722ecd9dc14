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

package dev.mars.wallet.api.init;

import io.vertx.core.Future;

/**
 * One asynchronous setup action that must succeed before the service accepts
 * traffic, for example opening the database pool.
 *
 * <p>Retry policy, if any, belongs to the step itself. The initializer running
 * the steps never retries.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public interface InitializationStep {

    /** A short, human-readable name for logging. */
    String name();

    /**
     * Performs the setup action.
     *
     * @return a future completing when the dependency is usable, or failing with the cause
     */
    Future<Void> initialize();

    /**
     * Releases what {@link #initialize()} acquired. Must be non-blocking and safe to
     * call multiple times.
     */
    default Future<Void> close() {
        return Future.succeededFuture();
    }
}
