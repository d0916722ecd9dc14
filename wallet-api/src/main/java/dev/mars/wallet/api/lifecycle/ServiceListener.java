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

package dev.mars.wallet.api.lifecycle;

import io.vertx.core.Verticle;

/**
 * A verticle that owns the network listener of the service.
 *
 * <p>Deploying the verticle binds the listener; undeploying it stops accepting
 * connections and drains in-flight requests before completing.</p>
 */
public interface ServiceListener extends Verticle {

    /**
     * Returns the endpoint bound during deployment.
     *
     * @return the bound endpoint
     * @throws IllegalStateException if the verticle has not been deployed yet
     */
    ListenerHandle listenerHandle();
}
