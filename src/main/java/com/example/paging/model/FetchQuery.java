package com.example.paging.model;

import com.example.paging.filter.FilterSpec;

/**
 * Parameters for fetching a single page.
 *
 * <p>A null {@code pageKey} asks for the first page; subsequent pages use the
 * {@link Page#nextKey()} of the page before. A null {@code filter} means no filtering
 * or sorting at all, which is distinct from an empty {@link FilterSpec}.
 *
 * @param <K> the type of the page key
 */
public record FetchQuery<K>(
        int pageSize,
        K pageKey,
        FilterSpec filter
) {
    public FetchQuery {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, got: " + pageSize);
        }
    }

    /**
     * Creates a query for the first page.
     */
    public static <K> FetchQuery<K> first(int pageSize, FilterSpec filter) {
        return new FetchQuery<>(pageSize, null, filter);
    }

    public FetchQuery<K> withPageKey(K pageKey) {
        return new FetchQuery<>(pageSize, pageKey, filter);
    }

    public FetchQuery<K> withFilter(FilterSpec filter) {
        return new FetchQuery<>(pageSize, pageKey, filter);
    }

    /**
     * Returns true if this query asks for the first page.
     */
    public boolean isFirstPage() {
        return pageKey == null;
    }
}
