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

package dev.mars.wallet.runtime.signal;

import java.util.function.Consumer;

/**
 * Source of OS termination signals.
 */
public interface TerminationSignals {

    /**
     * Registers a handler for a signal.
     *
     * @param signalName signal name without the {@code SIG} prefix, e.g. {@code TERM}
     * @param handler    receives the full signal name, e.g. {@code SIGTERM}
     */
    void register(String signalName, Consumer<String> handler);
}
