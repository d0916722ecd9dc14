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

package dev.mars.wallet.api.error;

/**
 * Immutable error record behind every JSON error response.
 *
 * @param code    The symbolic error code (see {@link WalletErrorCodes})
 * @param message Human-readable error message
 * @param stack   Stack trace exposed to clients in development only (can be null)
 */
public record WalletError(
    String code,
    String message,
    String stack
) {
    /**
     * Creates an error with code and message and no stack.
     */
    public static WalletError of(String code, String message) {
        return new WalletError(code, message, null);
    }

    /**
     * Creates a route not found error for the given request path.
     */
    public static WalletError routeNotFound(String path) {
        return of(WalletErrorCodes.ROUTE_NOT_FOUND, "Route " + path + " not found");
    }

    /**
     * Returns a copy carrying the given stack trace.
     */
    public WalletError withStack(String stack) {
        return new WalletError(code, message, stack);
    }
}
