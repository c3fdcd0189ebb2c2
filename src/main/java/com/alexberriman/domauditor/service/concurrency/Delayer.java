package com.alexberriman.domauditor.service.concurrency;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Suspends an asynchronous pipeline for a number of milliseconds without blocking a thread.
 *
 * <p>Tests substitute an implementation that completes immediately and records the delays.
 */
@FunctionalInterface
public interface Delayer {

    CompletableFuture<Void> delay(long millis);

    /**
     * Timer-backed delay using {@link CompletableFuture#delayedExecutor(long, TimeUnit)}.
     */
    static Delayer system() {
        return millis -> {
            if (millis <= 0) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(() -> { },
                    CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS));
        };
    }
}
