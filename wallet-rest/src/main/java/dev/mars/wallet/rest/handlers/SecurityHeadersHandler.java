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

import io.vertx.core.MultiMap;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.SecurityPolicyHandler;

/**
 * Response headers that have no dedicated Vert.x Web handler. Content-Security-Policy,
 * X-Frame-Options and Strict-Transport-Security are installed with
 * {@code CSPHandler}, {@code XFrameHandler} and {@code HSTSHandler}.
 */
public class SecurityHeadersHandler implements SecurityPolicyHandler {

    @Override
    public void handle(RoutingContext ctx) {
        MultiMap headers = ctx.response().headers();
        headers.set("X-Content-Type-Options", "nosniff");
        headers.set("Referrer-Policy", "no-referrer");
        headers.set("X-DNS-Prefetch-Control", "off");
        headers.set("X-Download-Options", "noopen");
        headers.set("X-Permitted-Cross-Domain-Policies", "none");
        headers.set("Cross-Origin-Opener-Policy", "same-origin");
        headers.set("Cross-Origin-Resource-Policy", "same-origin");
        headers.set("Origin-Agent-Cluster", "?1");
        // Disables legacy XSS auditors
        headers.set("X-XSS-Protection", "0");
        ctx.next();
    }
}
