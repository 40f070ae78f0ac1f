package com.example.paging.cache;

import com.example.paging.model.FetchQuery;
import com.example.paging.model.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Default in-memory {@link CacheStore}: bounded, least-recently-used eviction,
 * optional per-entry TTL. The query parameter is ignored.
 *
 * <p>All operations complete immediately. Methods are synchronized so a store
 * can be shared by paginators running on different threads.
 *
 * <pre>{@code
 * MemoryCacheStore<Product, Integer> cache = new MemoryCacheStore<>(500);
 * cache.put(key, query, page, Duration.ofMinutes(5));
 * }</pre>
 *
 * @param <T> the type of items
 * @param <K> the type of the page key
 */
public class MemoryCacheStore<T, K> implements CacheStore<T, K> {

    private static final Logger log = LoggerFactory.getLogger(MemoryCacheStore.class);

    public static final int DEFAULT_MAX_ENTRIES = 256;

    private final int maxEntries;
    private final Clock clock;

    // access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry<T, K>> entries = new LinkedHashMap<>(16, 0.75f, true);

    public MemoryCacheStore() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public MemoryCacheStore(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public MemoryCacheStore(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public CompletableFuture<Optional<Page<T, K>>> get(String key, FetchQuery<K> query) {
        return CompletableFuture.completedFuture(lookup(key));
    }

    @Override
    public CompletableFuture<Void> put(String key, FetchQuery<K> query, Page<T, K> page, Duration ttl) {
        store(key, page, ttl);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> remove(String key) {
        entries.remove(key);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> clear() {
        entries.clear();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Boolean> has(String key) {
        return CompletableFuture.completedFuture(lookup(key).isPresent());
    }

    /**
     * Returns the number of live (non-expired) entries.
     */
    public synchronized int size() {
        pruneExpired(clock.instant());
        return entries.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    private synchronized Optional<Page<T, K>> lookup(String key) {
        Objects.requireNonNull(key, "key must not be null");
        CacheEntry<T, K> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            log.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry.page());
    }

    private synchronized void store(String key, Page<T, K> page, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(page, "page must not be null");
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative, got: " + ttl);
        }

        Instant now = clock.instant();
        pruneExpired(now);
        entries.put(key, new CacheEntry<>(page, ttl != null ? now.plus(ttl) : null));
        evictIfNeeded();
    }

    private void pruneExpired(Instant now) {
        entries.values().removeIf(entry -> entry.isExpired(now));
    }

    private void evictIfNeeded() {
        Iterator<Map.Entry<String, CacheEntry<T, K>>> it = entries.entrySet().iterator();
        while (entries.size() > maxEntries && it.hasNext()) {
            String evicted = it.next().getKey();
            it.remove();
            log.debug("Evicted least recently used cache entry: {}", evicted);
        }
    }
}
