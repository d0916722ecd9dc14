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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Installs handlers through {@link Signal}. Replaces the JVM's default handler, so the
 * process only exits when the handler decides to.
 */
public class JvmTerminationSignals implements TerminationSignals {
    private static final Logger logger = LoggerFactory.getLogger(JvmTerminationSignals.class);

    @Override
    public void register(String signalName, Consumer<String> handler) {
        Objects.requireNonNull(signalName, "signalName");
        Objects.requireNonNull(handler, "handler");
        try {
            Signal.handle(new Signal(signalName), signal -> handler.accept("SIG" + signal.getName()));
            logger.debug("Registered handler for SIG{}", signalName);
        } catch (IllegalArgumentException e) {
            // Reserved by the JVM (for example under -Xrs) or unknown on this platform
            logger.warn("Unable to register handler for SIG{}: {}", signalName, e.getMessage());
        }
    }
}
