package com.example.paging.cache;

import com.example.paging.model.FetchQuery;
import com.example.paging.model.Page;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Query-aware page cache with optional per-entry time-to-live.
 *
 * <p>Keys are always derived by the paginator through {@link CacheKeys}; stores
 * never build or guess them. The query is passed along for stores that need
 * backend context (for instance one that re-validates against a remote cache);
 * simple stores ignore it.
 *
 * <p>Consistency of concurrent calls on the same key is the store's own concern.
 *
 * @param <T> the type of items
 * @param <K> the type of the page key
 */
public interface CacheStore<T, K> {

    /**
     * Looks up a page. Completes with {@code Optional.empty()} both for keys that were
     * never stored and for expired ones.
     */
    CompletableFuture<Optional<Page<T, K>>> get(String key, FetchQuery<K> query);

    /**
     * Stores a page. A null ttl means the entry never expires.
     */
    CompletableFuture<Void> put(String key, FetchQuery<K> query, Page<T, K> page, Duration ttl);

    /**
     * Stores a page that never expires.
     */
    default CompletableFuture<Void> put(String key, FetchQuery<K> query, Page<T, K> page) {
        return put(key, query, page, null);
    }

    CompletableFuture<Void> remove(String key);

    CompletableFuture<Void> clear();

    /**
     * Returns true if the key is present and not expired.
     */
    CompletableFuture<Boolean> has(String key);
}
