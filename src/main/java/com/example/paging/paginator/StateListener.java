package com.example.paging.paginator;

import com.example.paging.model.PageState;

/**
 * Receives every state snapshot a {@link Paginator} publishes, in publication order.
 *
 * @param <T> the type of items
 */
@FunctionalInterface
public interface StateListener<T> {

    void onStateChanged(PageState<T> state);

    /**
     * Called once when the paginator is closed. No further snapshots follow.
     */
    default void onClosed() {
    }
}
