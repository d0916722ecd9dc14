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

import java.util.Optional;

/**
 * Read-only view of the service lifecycle, handed to components that need to
 * report readiness without being able to change it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public interface ServiceStatus {

    /**
     * @return the current lifecycle state
     */
    ServiceState state();

    /**
     * @return the bound listener, empty unless the service is or was ready
     */
    Optional<ListenerHandle> listener();

    /**
     * @return true when the service accepts traffic
     */
    default boolean isReady() {
        return state().acceptsTraffic();
    }
}
