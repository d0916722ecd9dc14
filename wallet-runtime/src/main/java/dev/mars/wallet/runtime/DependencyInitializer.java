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

package dev.mars.wallet.runtime;

import dev.mars.wallet.api.init.InitializationException;
import dev.mars.wallet.api.init.InitializationStep;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Brings up the external dependencies of the service, one step after another.
 *
 * <p>Steps run in the order given. The first failure stops the sequence and fails
 * {@link #initialize()} with an {@link InitializationException}; later steps are never
 * attempted. There are no retries here: a failed start is left to the process supervisor.</p>
 *
 * <p>{@link #close()} releases the steps that did initialize, in reverse order.</p>
 */
public class DependencyInitializer {
    private static final Logger logger = LoggerFactory.getLogger(DependencyInitializer.class);

    private final List<InitializationStep> steps;
    private final List<InitializationStep> initialized = new CopyOnWriteArrayList<>();
    private final AtomicBoolean invoked = new AtomicBoolean(false);
    private Future<Void> closeFuture;

    public DependencyInitializer(List<? extends InitializationStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public List<InitializationStep> steps() {
        return steps;
    }

    /**
     * Runs every step in order.
     *
     * @return future completing when all steps succeeded, or failing with an
     *         {@link InitializationException} naming the first step that failed
     */
    public Future<Void> initialize() {
        if (!invoked.compareAndSet(false, true)) {
            return Future.failedFuture(new InitializationException("initialize() may only be called once"));
        }

        Future<Void> chain = Future.succeededFuture();
        for (InitializationStep step : steps) {
            chain = chain.compose(v -> runStep(step));
        }
        return chain
            .onSuccess(v -> logger.info("All services initialized successfully"))
            .onFailure(err -> logger.error("Failed to initialize services: {}", err.getMessage(), err.getCause()));
    }

    private Future<Void> runStep(InitializationStep step) {
        logger.debug("Initializing {}", step.name());
        Future<Void> result;
        try {
            result = step.initialize();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result.compose(
            v -> {
                initialized.add(step);
                logger.debug("Initialized {}", step.name());
                return Future.<Void>succeededFuture();
            },
            err -> Future.<Void>failedFuture(new InitializationException(step.name(), err)));
    }

    /**
     * Closes the initialized steps in reverse order. Each close is attempted even if an
     * earlier one failed. Repeated calls return the same future.
     *
     * @return future that always succeeds once every close has been attempted
     */
    public synchronized Future<Void> close() {
        if (closeFuture != null) {
            return closeFuture;
        }
        List<InitializationStep> reversed = new ArrayList<>(initialized);
        Collections.reverse(reversed);

        Future<Void> chain = Future.succeededFuture();
        for (InitializationStep step : reversed) {
            chain = chain.compose(ignored -> closeStep(step)
                .onSuccess(v -> logger.debug("Closed {}", step.name()))
                .onFailure(e -> logger.warn("Failed to close {}: {}", step.name(), e.getMessage()))
                .recover(e -> Future.succeededFuture()));
        }
        closeFuture = chain;
        return chain;
    }

    private static Future<Void> closeStep(InitializationStep step) {
        try {
            return step.close();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
