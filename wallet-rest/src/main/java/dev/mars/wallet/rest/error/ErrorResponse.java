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

package dev.mars.wallet.rest.error;

import dev.mars.wallet.api.error.WalletError;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Utility class for sending the service's JSON error envelope:
 * {@code {"error": <reason phrase>, "message": ..., "code": ...}}.
 */
public final class ErrorResponse {

    private ErrorResponse() {
        // Utility class - no instantiation
    }

    /**
     * Sends an error response with the given WalletError.
     *
     * @param ctx        The routing context
     * @param statusCode HTTP status code
     * @param error      The wallet error
     */
    public static void send(RoutingContext ctx, int statusCode, WalletError error) {
        ctx.response()
            .setStatusCode(statusCode)
            .putHeader("Content-Type", "application/json")
            .end(toJson(statusCode, error).encode());
    }

    /**
     * Sends a 404 Not Found error.
     */
    public static void notFound(RoutingContext ctx, WalletError error) {
        send(ctx, 404, error);
    }

    /**
     * Converts a WalletError to the envelope sent with the given status.
     */
    public static JsonObject toJson(int statusCode, WalletError error) {
        JsonObject json = new JsonObject()
            .put("error", reasonPhrase(statusCode))
            .put("message", error.message())
            .put("code", error.code());

        if (error.stack() != null) {
            json.put("stack", error.stack());
        }

        return json;
    }

    /**
     * @return the standard reason phrase, e.g. {@code Not Found} for 404
     */
    public static String reasonPhrase(int statusCode) {
        return HttpResponseStatus.valueOf(statusCode).reasonPhrase();
    }
}
