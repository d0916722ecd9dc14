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

/**
 * Raised when a dependency initialization step fails. Fatal to startup.
 */
public class InitializationException extends RuntimeException {

    private final String stepName;

    public InitializationException(String stepName, Throwable cause) {
        super("Initialization step '" + stepName + "' failed: "
                + (cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.stepName = stepName;
    }

    public InitializationException(String message) {
        super(message);
        this.stepName = null;
    }

    /**
     * @return the failing step, or null when the failure is not tied to a step
     */
    public String getStepName() {
        return stepName;
    }
}
