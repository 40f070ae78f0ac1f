package com.example.paging.source;

import com.example.paging.model.FetchQuery;
import com.example.paging.model.Page;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link PageSource} slicing a fixed list by integer offset.
 *
 * <p>The page key is the offset of the first item of the page; the first page
 * starts at 0. Filters are not interpreted. Useful for demos and for exercising
 * a paginator without a backend.
 *
 * @param <T> the type of items
 */
public class ListPageSource<T> implements PageSource<T, Integer> {

    private final List<T> items;
    private final AtomicInteger fetchCount = new AtomicInteger();

    public ListPageSource(List<T> items) {
        this.items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
    }

    @Override
    public CompletableFuture<Page<T, Integer>> fetch(FetchQuery<Integer> query) {
        fetchCount.incrementAndGet();

        int offset = query.pageKey() != null ? query.pageKey() : 0;
        if (offset < 0 || offset > items.size()) {
            return CompletableFuture.failedFuture(
                    new IndexOutOfBoundsException("Offset " + offset + " outside 0.." + items.size()));
        }

        int end = Math.min(offset + query.pageSize(), items.size());
        boolean last = end >= items.size();
        Page<T, Integer> page = new Page<>(items.subList(offset, end), last ? null : end, last, items.size());
        return CompletableFuture.completedFuture(page);
    }

    /**
     * Returns how many times {@link #fetch} has been called.
     */
    public int getFetchCount() {
        return fetchCount.get();
    }
}
