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

import dev.mars.wallet.api.lifecycle.ListenerHandle;
import dev.mars.wallet.api.lifecycle.ServiceListener;
import dev.mars.wallet.api.lifecycle.ServiceState;
import dev.mars.wallet.api.lifecycle.ServiceStatus;
import dev.mars.wallet.runtime.signal.TerminationSignals;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Owns the process lifecycle of the service.
 *
 * <p>Startup runs the {@link DependencyInitializer} and only then deploys the listener
 * verticle, so no socket is open before every dependency is usable. The first
 * termination signal starts a graceful shutdown: the listener stops accepting, in-flight
 * requests drain, dependencies close and the process exits with status 0. Any fatal
 * startup failure exits with status 1. The process exits exactly once.</p>
 *
 * <p>State transitions are atomic, so signals may arrive on the JVM's signal thread
 * while startup callbacks run on the event loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-30
 * @version 1.0
 */
public class ServiceLifecycleManager implements ServiceStatus {
    private static final Logger logger = LoggerFactory.getLogger(ServiceLifecycleManager.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final Vertx vertx;
    private final LifecycleOptions options;
    private final DependencyInitializer initializer;
    private final Supplier<? extends ServiceListener> listenerFactory;
    private final ProcessTerminator terminator;

    private final AtomicReference<ServiceState> state = new AtomicReference<>(ServiceState.INITIALIZING);
    private final AtomicBoolean startInvoked = new AtomicBoolean(false);
    private final AtomicBoolean exited = new AtomicBoolean(false);
    private final Promise<String> shutdownToken = Promise.promise();
    private final Promise<Void> startupSettled = Promise.promise();
    private final Promise<Integer> terminated = Promise.promise();

    private volatile ListenerHandle listener;
    private volatile String deploymentId;

    public ServiceLifecycleManager(Vertx vertx,
                                   LifecycleOptions options,
                                   DependencyInitializer initializer,
                                   Supplier<? extends ServiceListener> listenerFactory,
                                   ProcessTerminator terminator) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.options = Objects.requireNonNull(options, "options");
        this.initializer = Objects.requireNonNull(initializer, "initializer");
        this.listenerFactory = Objects.requireNonNull(listenerFactory, "listenerFactory");
        this.terminator = Objects.requireNonNull(terminator, "terminator");
    }

    /**
     * Initializes dependencies, then binds the listener.
     *
     * <p>On initialization or bind failure the process is terminated with status 1 and the
     * returned future fails. If a termination signal arrived while dependencies were
     * initializing, the bind is skipped and the shutdown sequence finishes the process.</p>
     *
     * @return future completing with the bound endpoint once the service is {@code READY}
     */
    public Future<ListenerHandle> start() {
        if (!startInvoked.compareAndSet(false, true)) {
            return Future.failedFuture(new IllegalStateException("start() may only be called once"));
        }

        Promise<ListenerHandle> result = Promise.promise();
        initializer.initialize().onComplete(init -> {
            if (init.failed()) {
                state.set(ServiceState.STOPPED);
                startupSettled.tryComplete();
                exit(EXIT_FAILURE);
                result.fail(init.cause());
                return;
            }
            if (state.get().isTerminating()) {
                logger.info("Shutdown requested during initialization, not binding listener");
                startupSettled.tryComplete();
                result.fail(new IllegalStateException("Shutdown requested before the listener was bound"));
                return;
            }
            bindListener(result);
        });
        return result.future();
    }

    private void bindListener(Promise<ListenerHandle> result) {
        ServiceListener verticle;
        try {
            verticle = listenerFactory.get();
        } catch (RuntimeException e) {
            failBind(e, result);
            return;
        }

        vertx.deployVerticle(verticle).onComplete(deployment -> {
            if (deployment.failed()) {
                failBind(deployment.cause(), result);
                return;
            }
            deploymentId = deployment.result();
            ListenerHandle handle = verticle.listenerHandle();
            listener = handle;
            if (state.compareAndSet(ServiceState.INITIALIZING, ServiceState.READY)) {
                logger.info("{} running on {}:{}", options.displayName(), handle.host(), handle.port());
            }
            startupSettled.tryComplete();
            result.complete(handle);
        });
    }

    private void failBind(Throwable cause, Promise<ListenerHandle> result) {
        logger.error("Failed to start server", cause);
        initializer.close().onComplete(closed -> {
            state.set(ServiceState.STOPPED);
            startupSettled.tryComplete();
            exit(EXIT_FAILURE);
            result.fail(cause);
        });
    }

    /**
     * Handles {@code SIGINT} and {@code SIGTERM}. Only the first call has an effect.
     *
     * @param signal signal name as reported to the handler, e.g. {@code SIGTERM}
     */
    public void onTerminationSignal(String signal) {
        ServiceState current = state.get();
        while (true) {
            if (current.isTerminating()) {
                logger.debug("Ignoring {}: service is already {}", signal, current);
                return;
            }
            if (state.compareAndSet(current, ServiceState.SHUTTING_DOWN)) {
                break;
            }
            current = state.get();
        }

        logger.info("Received {}. Shutting down gracefully...", signal);
        shutdownToken.tryComplete(signal);

        // Signal before start(): nothing will settle the startup, and start() must not run later
        if (startInvoked.compareAndSet(false, true)) {
            startupSettled.tryComplete();
        }

        startupSettled.future()
            .compose(v -> closeListener())
            .onComplete(closed -> {
                int status;
                if (closed.succeeded()) {
                    if (closed.result()) {
                        logger.info("Server closed");
                    } else {
                        logger.debug("No listener was bound, nothing to close");
                    }
                    status = EXIT_OK;
                } else {
                    logger.error("Error while closing server", closed.cause());
                    status = EXIT_FAILURE;
                }
                listener = null;
                initializer.close().onComplete(v -> {
                    state.set(ServiceState.STOPPED);
                    exit(status);
                });
            });
    }

    /**
     * @return {@code true} once a bound listener was undeployed, {@code false} if none was bound
     */
    private Future<Boolean> closeListener() {
        String id = deploymentId;
        if (id == null) {
            return Future.succeededFuture(false);
        }
        deploymentId = null;

        long guardMs = options.closeGuard().toMillis();
        Promise<Boolean> closed = Promise.promise();
        long timerId = vertx.setTimer(Math.max(1, guardMs), t -> closed.tryFail(
            new TimeoutException("Listener did not close within " + guardMs + " ms")));
        vertx.undeploy(id).onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                closed.tryComplete(true);
            } else {
                closed.tryFail(ar.cause());
            }
        });
        return closed.future();
    }

    /**
     * Routes {@code INT} and {@code TERM} to {@link #onTerminationSignal(String)}.
     */
    public void registerSignalHandlers(TerminationSignals signals) {
        signals.register("INT", this::onTerminationSignal);
        signals.register("TERM", this::onTerminationSignal);
    }

    private void exit(int status) {
        if (!exited.compareAndSet(false, true)) {
            logger.debug("Exit with status {} suppressed, process already exiting", status);
            return;
        }
        if (state.get() == ServiceState.STOPPED) {
            listener = null;
        }
        terminator.exit(status);
        terminated.tryComplete(status);
    }

    @Override
    public ServiceState state() {
        return state.get();
    }

    @Override
    public Optional<ListenerHandle> listener() {
        return Optional.ofNullable(listener);
    }

    /**
     * @return completes with the name of the first termination signal
     */
    public Future<String> shutdownRequested() {
        return shutdownToken.future();
    }

    /**
     * @return completes with the exit status passed to the {@link ProcessTerminator}
     */
    public Future<Integer> terminated() {
        return terminated.future();
    }

    public LifecycleOptions options() {
        return options;
    }
}
