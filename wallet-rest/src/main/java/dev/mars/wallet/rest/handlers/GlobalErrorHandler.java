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

package dev.mars.wallet.rest.handlers;

import dev.mars.wallet.api.error.WalletError;
import dev.mars.wallet.api.error.WalletErrorCodes;
import dev.mars.wallet.api.error.WalletServiceException;
import dev.mars.wallet.rest.error.ErrorResponse;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.HttpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Failure handler turning every request failure into the JSON error envelope.
 *
 * <p>Status resolution: a {@link WalletServiceException}'s status, else a Vert.x
 * {@link HttpException}'s status, else the status the route failed with, else 500.
 * Server errors are logged at ERROR with the stack trace, client errors at WARN.
 * The stack is included in the body only when enabled ({@code NODE_ENV=development}).</p>
 */
public class GlobalErrorHandler implements Handler<RoutingContext> {
    private static final Logger logger = LoggerFactory.getLogger(GlobalErrorHandler.class);

    private final boolean includeStack;

    public GlobalErrorHandler(boolean includeStack) {
        this.includeStack = includeStack;
    }

    @Override
    public void handle(RoutingContext ctx) {
        Throwable failure = ctx.failure();
        int status = resolveStatus(ctx, failure);
        String reason = ErrorResponse.reasonPhrase(status);
        String message = failure != null && failure.getMessage() != null ? failure.getMessage() : reason;
        String code = failure instanceof WalletServiceException
            ? ((WalletServiceException) failure).getCode()
            : WalletErrorCodes.forStatus(status);

        String method = ctx.request().method().name();
        String uri = ctx.request().uri();
        if (status >= 500) {
            logger.error("Request failed: {} {} -> {} {}", method, uri, status, message, failure);
        } else {
            logger.warn("Request rejected: {} {} -> {} {}", method, uri, status, message);
        }

        if (ctx.response().headWritten()) {
            // Head already sent, abort the connection
            ctx.request().connection().close();
            return;
        }

        WalletError error = WalletError.of(code, message);
        if (includeStack && failure != null) {
            error = error.withStack(stackTrace(failure));
        }
        ErrorResponse.send(ctx, status, error);
    }

    static int resolveStatus(RoutingContext ctx, Throwable failure) {
        if (failure instanceof WalletServiceException) {
            return ((WalletServiceException) failure).getStatusCode();
        }
        if (failure instanceof HttpException) {
            int status = ((HttpException) failure).getStatusCode();
            if (status >= 400 && status <= 599) {
                return status;
            }
        }
        int status = ctx.statusCode();
        return status >= 400 && status <= 599 ? status : 500;
    }

    private static String stackTrace(Throwable failure) {
        StringWriter writer = new StringWriter();
        failure.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
