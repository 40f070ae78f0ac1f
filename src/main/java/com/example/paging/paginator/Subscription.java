package com.example.paging.paginator;

/**
 * Handle returned by {@link Paginator#subscribe}. Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
