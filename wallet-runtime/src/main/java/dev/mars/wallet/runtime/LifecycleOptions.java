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

package dev.mars.wallet.runtime;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the service lifecycle.
 *
 * @param displayName  name used in lifecycle log lines, e.g. {@code Wallet Service}
 * @param drainTimeout how long in-flight requests may run after a termination signal
 * @param gracePeriod  extra time allowed for the listener to finish closing after the drain timeout
 */
public record LifecycleOptions(String displayName, Duration drainTimeout, Duration gracePeriod) {

    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(5);

    public LifecycleOptions {
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        Objects.requireNonNull(gracePeriod, "gracePeriod");
        if (displayName.isBlank()) {
            throw new IllegalArgumentException("displayName must not be blank");
        }
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must not be negative");
        }
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative");
        }
    }

    public LifecycleOptions(String displayName, Duration drainTimeout) {
        this(displayName, drainTimeout, DEFAULT_GRACE_PERIOD);
    }

    public LifecycleOptions(String displayName) {
        this(displayName, DEFAULT_DRAIN_TIMEOUT, DEFAULT_GRACE_PERIOD);
    }

    /**
     * Upper bound on the whole listener close.
     */
    public Duration closeGuard() {
        return drainTimeout.plus(gracePeriod);
    }
}
