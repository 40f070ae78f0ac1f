package com.example.paging.source;

import com.example.paging.model.FetchQuery;
import com.example.paging.model.Page;

import java.util.concurrent.CompletableFuture;

/**
 * Backend integration contract: fetches one page for a query.
 *
 * <p>Implementations interpret {@link FetchQuery#filter()} for their backend,
 * use {@link FetchQuery#pageKey()} to locate the page (null for the first one)
 * and complete the future exceptionally on any transport or backend problem.
 * They must not swallow their own failures: retry and cache fallback depend
 * on seeing them.
 *
 * <pre>{@code
 * PageSource<Product, Integer> source = query -> client.getProductsAsync(
 *         query.pageKey() == null ? 0 : query.pageKey(),
 *         query.pageSize())
 *     .thenApply(response -> new Page<>(
 *         response.products(),
 *         response.hasMore() ? response.offset() + query.pageSize() : null,
 *         !response.hasMore()));
 * }</pre>
 *
 * @param <T> the type of items
 * @param <K> the type of the page key
 */
@FunctionalInterface
public interface PageSource<T, K> {

    /**
     * Asynchronously fetches the page described by the query.
     *
     * @param query page size, page key and optional filter
     * @return a CompletableFuture that completes with the page
     */
    CompletableFuture<Page<T, K>> fetch(FetchQuery<K> query);
}
