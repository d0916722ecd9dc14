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

package dev.mars.wallet.rest.routes;

import io.vertx.ext.web.Router;

import java.util.List;
import java.util.ServiceLoader;

/**
 * A set of routes served under {@code /api/v1}.
 *
 * <p>Implementations are discovered with {@link ServiceLoader}; register them in
 * {@code META-INF/services/dev.mars.wallet.rest.routes.ApiRoutes}. Paths given to the
 * router are relative to {@code /api/v1}. Failures should be passed to
 * {@code RoutingContext.fail}, ideally as a {@code WalletServiceException}, so the global
 * error handler renders them.</p>
 */
public interface ApiRoutes {

    /**
     * Adds routes to the {@code /api/v1} sub-router.
     */
    void mount(Router router, ApiContext context);

    /**
     * @return every implementation found on the class path
     */
    static List<ApiRoutes> discover() {
        return ServiceLoader.load(ApiRoutes.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    }
}
