// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.util.Errors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/// Runs a unit of work on an executor with at-least-once semantics: if it throws, it is submitted
/// again, up to a maximum number of deliveries. A unit that fails every delivery completes with a
/// fallback value instead of failing the futures that depend on it, so one bad chunk does not
/// take down its siblings.
public class Redelivery {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Executor executor;
    private final int maxDeliveries;

    public Redelivery (Executor executor, int maxDeliveries) {
        this.executor = executor;
        this.maxDeliveries = Math.max(1, maxDeliveries);
    }

    public <T> CompletableFuture<T> deliver (String name, Supplier<T> unit, Supplier<T> fallback) {
        return deliver(name, unit, fallback, 1);
    }

    private <T> CompletableFuture<T> deliver (String name, Supplier<T> unit, Supplier<T> fallback, int delivery) {
        return CompletableFuture.supplyAsync(unit, executor).handle((result, throwable) -> {
            if (throwable == null) {
                return CompletableFuture.completedFuture(result);
            }
            String message = Errors.briefThrowableMessage(throwable);
            if (delivery >= maxDeliveries) {
                LOG.error("{} failed on delivery {} of {}, giving up: {}", name, delivery, maxDeliveries,
                      message, Errors.unwrap(throwable));
                return CompletableFuture.completedFuture(fallback.get());
            }
            LOG.warn("{} failed on delivery {} of {}, redelivering: {}", name, delivery, maxDeliveries, message);
            return deliver(name, unit, fallback, delivery + 1);
        }).thenCompose(future -> future);
    }

}
