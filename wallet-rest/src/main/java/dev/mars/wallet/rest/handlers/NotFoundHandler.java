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
import dev.mars.wallet.rest.error.ErrorResponse;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;

/**
 * Last route of the router: answers 404 with the original request URI, query string included.
 */
public class NotFoundHandler implements Handler<RoutingContext> {

    @Override
    public void handle(RoutingContext ctx) {
        ErrorResponse.notFound(ctx, WalletError.routeNotFound(ctx.request().uri()));
    }
}
