package com.example.paging.model;

import java.util.List;

/**
 * One page of items returned by a {@link com.example.paging.source.PageSource}.
 * Contains the items for the current page and the key to fetch the page after it.
 *
 * @param <T> the type of items in the page
 * @param <K> the type of the page key (offset, cursor token, document handle)
 */
public record Page<T, K>(
        List<T> items,
        K nextKey,
        boolean isLast,
        Integer totalCount
) {
    public Page {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public Page(List<T> items, K nextKey, boolean isLast) {
        this(items, nextKey, isLast, null);
    }

    /**
     * Creates an empty last page.
     */
    public static <T, K> Page<T, K> empty() {
        return new Page<>(List.of(), null, true);
    }

    /**
     * Creates a page with items and a next key. A null key marks the last page.
     */
    public static <T, K> Page<T, K> of(List<T> items, K nextKey) {
        return new Page<>(items, nextKey, nextKey == null);
    }

    /**
     * Creates the last page (no more pages after this).
     */
    public static <T, K> Page<T, K> last(List<T> items) {
        return new Page<>(items, null, true);
    }

    /**
     * Returns a copy of this page carrying the total item count reported by the backend.
     */
    public Page<T, K> withTotalCount(int totalCount) {
        return new Page<>(items, nextKey, isLast, totalCount);
    }

    /**
     * Returns the number of items in this page.
     */
    public int size() {
        return items.size();
    }

    /**
     * Checks if this page is empty.
     */
    public boolean isEmpty() {
        return items.isEmpty();
    }
}
