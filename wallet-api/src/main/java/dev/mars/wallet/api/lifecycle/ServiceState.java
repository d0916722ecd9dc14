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

/**
 * Process-lifetime state of the wallet service.
 *
 * <p>Transitions only move forward:
 * {@code INITIALIZING -> READY -> SHUTTING_DOWN -> STOPPED}. A shutdown requested
 * before the listener is bound skips {@code READY}, and a fatal startup failure
 * goes straight from {@code INITIALIZING} to {@code STOPPED}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public enum ServiceState {

    /** Dependencies are being initialized; no listener is bound. */
    INITIALIZING,

    /** Dependencies are up and the listener accepts connections. */
    READY,

    /** A termination signal was received; in-flight requests are draining. */
    SHUTTING_DOWN,

    /** The listener is closed and dependencies are released. */
    STOPPED;

    /**
     * @return true only when the service accepts new traffic
     */
    public boolean acceptsTraffic() {
        return this == READY;
    }

    /**
     * @return true once shutdown has begun or completed
     */
    public boolean isTerminating() {
        return this == SHUTTING_DOWN || this == STOPPED;
    }
}
