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
 * Unchecked exception for request handlers that want a specific HTTP status and
 * error code in the JSON error envelope. Anything else reaching the global error
 * handler is reported as a 500 {@code INTERNAL_ERROR}.
 */
public class WalletServiceException extends RuntimeException {

    private final int statusCode;
    private final String code;

    public WalletServiceException(int statusCode, String code, String message) {
        this(statusCode, code, message, null);
    }

    public WalletServiceException(int statusCode, String code, String message, Throwable cause) {
        super(message, cause);
        if (statusCode < 400 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be an error status (400-599), was " + statusCode);
        }
        this.statusCode = statusCode;
        this.code = code != null ? code : WalletErrorCodes.forStatus(statusCode);
    }

    public static WalletServiceException badRequest(String message) {
        return new WalletServiceException(400, WalletErrorCodes.BAD_REQUEST, message);
    }

    public static WalletServiceException serviceUnavailable(String message) {
        return new WalletServiceException(503, WalletErrorCodes.SERVICE_UNAVAILABLE, message);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getCode() {
        return code;
    }
}
