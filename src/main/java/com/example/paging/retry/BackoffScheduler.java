package com.example.paging.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Non-blocking wait used between retries.
 */
@FunctionalInterface
public interface BackoffScheduler {

    /**
     * Returns a future that completes once the delay has elapsed.
     */
    CompletableFuture<Void> delay(Duration delay);

    /**
     * Waits on {@link CompletableFuture#delayedExecutor}, without holding a thread.
     */
    static BackoffScheduler system() {
        return delay -> {
            if (delay.isZero()) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(
                    () -> {},
                    CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
            );
        };
    }
}
