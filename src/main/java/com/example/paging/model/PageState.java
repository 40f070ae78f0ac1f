package com.example.paging.model;

import java.util.List;

/**
 * Immutable snapshot of a paginator's observable state.
 *
 * <p>A new snapshot is produced on every transition; snapshots are never mutated.
 *
 * @param items the items accumulated so far (unmodifiable)
 * @param status current lifecycle status
 * @param error the failure behind an {@link PageStatus#ERROR} status, otherwise null
 * @param hasMore whether another page can be loaded
 * @param isFromCache whether the last applied page came from the cache
 * @param isRefreshing whether a background refresh of cached data is running
 * @param retryAttempt the retry currently in progress (1-based), or null
 * @param <T> the type of items
 */
public record PageState<T>(
        List<T> items,
        PageStatus status,
        Throwable error,
        boolean hasMore,
        boolean isFromCache,
        boolean isRefreshing,
        Integer retryAttempt
) {
    public PageState {
        items = items != null ? List.copyOf(items) : List.of();
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    /**
     * Creates the state a paginator starts from: no items, idle, more pages assumed.
     */
    public static <T> PageState<T> initial() {
        return new PageState<>(List.of(), PageStatus.IDLE, null, true, false, false, null);
    }

    /**
     * Creates a ready state for a freshly applied page.
     */
    public static <T> PageState<T> ready(List<T> items, boolean hasMore, boolean isFromCache, boolean isRefreshing) {
        return new PageState<>(items, PageStatus.READY, null, hasMore, isFromCache, isRefreshing, null);
    }

    public PageState<T> withItems(List<T> items) {
        return new PageState<>(items, status, error, hasMore, isFromCache, isRefreshing, retryAttempt);
    }

    public PageState<T> withStatus(PageStatus status) {
        return new PageState<>(items, status, error, hasMore, isFromCache, isRefreshing, retryAttempt);
    }

    public PageState<T> withRefreshing(boolean isRefreshing) {
        return new PageState<>(items, status, error, hasMore, isFromCache, isRefreshing, retryAttempt);
    }

    public PageState<T> withRetryAttempt(Integer retryAttempt) {
        return new PageState<>(items, status, error, hasMore, isFromCache, isRefreshing, retryAttempt);
    }

    /**
     * Returns the state shown while a next page is loading: items kept, previous error cleared.
     */
    public PageState<T> loading() {
        return new PageState<>(items, PageStatus.LOADING, null, hasMore, isFromCache, false, null);
    }

    /**
     * Returns the error state for a failed load. Items and {@code hasMore} are kept.
     */
    public PageState<T> failed(Throwable error) {
        return new PageState<>(items, PageStatus.ERROR, error, hasMore, isFromCache, false, null);
    }

    public boolean isLoading() {
        return status == PageStatus.LOADING;
    }

    public boolean hasError() {
        return status == PageStatus.ERROR;
    }
}
