package com.example.paging.paginator;

import com.example.paging.cache.CacheKeys;
import com.example.paging.cache.CacheStore;
import com.example.paging.filter.FilterSpec;
import com.example.paging.model.FetchQuery;
import com.example.paging.model.Page;
import com.example.paging.model.PageState;
import com.example.paging.model.PageStatus;
import com.example.paging.retry.RetryController;
import com.example.paging.source.PageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.example.paging.retry.RetryController.unwrap;

/**
 * Pagination engine: accumulates pages from a {@link PageSource} according to a
 * {@link CachePolicy}, retries failed fetches and publishes every state change as
 * an immutable {@link PageState}.
 *
 * <p>Example usage:
 * <pre>{@code
 * Paginator<Product, Integer> paginator = new Paginator<>(
 *     productSource,
 *     new MemoryCacheStore<>(),
 *     PaginatorConfig.defaults()
 *         .withPageSize(20)
 *         .withRetryPolicy(RetryPolicy.defaults())
 * );
 *
 * paginator.subscribe(state -> render(state.items(), state.status()));
 *
 * paginator.loadInitial()
 *     .thenCompose(v -> paginator.loadNext())
 *     .thenRun(() -> System.out.println(paginator.state().items().size() + " items"));
 * }</pre>
 *
 * <h2>Status transitions</h2>
 * <ul>
 *   <li>{@code loadInitial()}, {@code refresh()} and {@code updateFilter()} publish a reset
 *       snapshot (no items, {@link PageStatus#IDLE}) before fetching</li>
 *   <li>{@code loadNext()} keeps the items and publishes {@link PageStatus#LOADING}</li>
 *   <li>a successful load publishes {@link PageStatus#READY}; a failed one
 *       {@link PageStatus#ERROR} with the items left in place</li>
 * </ul>
 *
 * <p>Returned futures complete when the load has finished, including the background refresh
 * of {@link CachePolicy#CACHE_FIRST}; they never complete exceptionally, failures end up in
 * {@link PageState#error()}.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. Operations must be called from a
 * single execution context. Pass that context as an {@link Executor} to have every
 * continuation after a fetch, cache call or backoff run on it as well; without one,
 * continuations run on whichever thread completed the future.
 *
 * <p>Only one load runs at a time. {@code refresh()} and {@code updateFilter()} pre-empt a
 * running load instead of waiting for it: outstanding fetches are not cancelled, but their
 * results are discarded once a newer load has started.
 *
 * @param <T> the type of items
 * @param <K> the type of the page key
 */
public class Paginator<T, K> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Paginator.class);

    private final PageSource<T, K> source;
    private final CacheStore<T, K> cache;
    private final PaginatorConfig config;
    private final RetryController retryController;
    private final Executor context;
    private final List<StateListener<T>> listeners = new CopyOnWriteArrayList<>();

    private volatile PageState<T> state = PageState.initial();
    private volatile FilterSpec currentFilter;
    private volatile K nextPageKey;
    private volatile boolean loading;
    private volatile long generation;
    private volatile boolean closed;

    /**
     * Creates a paginator without cache, using the default configuration.
     *
     * @param source the page source to fetch from
     */
    public Paginator(PageSource<T, K> source) {
        this(source, null, PaginatorConfig.defaults());
    }

    /**
     * Creates a paginator using the default configuration.
     *
     * @param source the page source to fetch from
     * @param cache the cache store, or null for none
     */
    public Paginator(PageSource<T, K> source, CacheStore<T, K> cache) {
        this(source, cache, PaginatorConfig.defaults());
    }

    /**
     * Creates a paginator with custom configuration.
     *
     * @param source the page source to fetch from
     * @param cache the cache store, or null for none
     * @param config page size, cache policy, retry policy, initial filter
     */
    public Paginator(PageSource<T, K> source, CacheStore<T, K> cache, PaginatorConfig config) {
        this(source, cache, config, new RetryController(), null);
    }

    /**
     * Creates a paginator with a custom retry controller and execution context.
     *
     * @param source the page source to fetch from
     * @param cache the cache store, or null for none
     * @param config page size, cache policy, retry policy, initial filter
     * @param retryController runs fetches with retry
     * @param context executor continuations hop onto, or null to stay on the completing thread
     */
    public Paginator(
            PageSource<T, K> source,
            CacheStore<T, K> cache,
            PaginatorConfig config,
            RetryController retryController,
            Executor context
    ) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.cache = cache;
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.retryController = Objects.requireNonNull(retryController, "retryController must not be null");
        this.context = context;
        this.currentFilter = config.initialFilter();
    }

    // =========================================================================
    // LOAD OPERATIONS
    // =========================================================================

    /**
     * Loads the first page, replacing all items.
     *
     * <p>Does nothing if a load is already in flight.
     *
     * @return a CompletableFuture that completes when the load has finished
     */
    public CompletableFuture<Void> loadInitial() {
        if (closed) {
            return done();
        }
        if (loading) {
            log.debug("loadInitial skipped: a load is already in flight");
            return done();
        }

        long run = beginLoad();
        nextPageKey = null;
        publish(PageState.initial());
        return runLoad(run, true);
    }

    /**
     * Loads the page after the last one and appends its items.
     *
     * <p>Does nothing if a load is in flight or there are no more pages.
     *
     * @return a CompletableFuture that completes when the load has finished
     */
    public CompletableFuture<Void> loadNext() {
        PageState<T> current = state;
        if (closed) {
            return done();
        }
        if (loading || current.status() == PageStatus.LOADING) {
            log.debug("loadNext skipped: a load is already in flight");
            return done();
        }
        if (!current.hasMore()) {
            log.debug("loadNext skipped: no more pages");
            return done();
        }

        long run = beginLoad();
        publish(current.loading());
        return runLoad(run, false);
    }

    /**
     * Clears the cache, then reloads the first page even if a load is in flight.
     *
     * @return a CompletableFuture that completes when the reload has finished
     */
    public CompletableFuture<Void> refresh() {
        return refresh(true);
    }

    /**
     * Reloads the first page even if a load is in flight.
     *
     * @param clearCache whether to clear the whole cache store first
     * @return a CompletableFuture that completes when the reload has finished
     */
    public CompletableFuture<Void> refresh(boolean clearCache) {
        if (closed) {
            return done();
        }
        if (!clearCache || cache == null) {
            return restart();
        }

        return onContext(safely(cache::clear))
                .handle((v, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to clear cache before refresh", unwrap(ex));
                    }
                    return null;
                })
                .thenCompose(v -> restart());
    }

    /**
     * Replaces the active filter and reloads the first page, pre-empting any load in flight.
     *
     * @param filter the new filter, or null for none
     * @return a CompletableFuture that completes when the reload has finished
     */
    public CompletableFuture<Void> updateFilter(FilterSpec filter) {
        if (closed) {
            return done();
        }
        currentFilter = filter;
        return restart();
    }

    // =========================================================================
    // LOCAL MUTATIONS
    // =========================================================================

    /**
     * Replaces every item matching the predicate with the given item.
     * Publishes a new snapshot even when nothing matched.
     *
     * @param item the replacement
     * @param predicate selects the items to replace
     */
    public void updateItem(T item, Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        List<T> current = state.items();
        List<T> updated = new ArrayList<>(current.size());
        for (T existing : current) {
            updated.add(predicate.test(existing) ? item : existing);
        }
        publish(state.withItems(updated));
    }

    /**
     * Removes every item matching the predicate, keeping the order of the others.
     *
     * @param predicate selects the items to remove
     */
    public void removeItem(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        List<T> remaining = new ArrayList<>(state.items());
        remaining.removeIf(predicate);
        publish(state.withItems(remaining));
    }

    /**
     * Inserts an item at the top of the list.
     *
     * @param item the item to insert
     */
    public void insertItem(T item) {
        insertItem(item, 0);
    }

    /**
     * Inserts an item at the given position, clamped to {@code [0, size]}.
     *
     * @param item the item to insert
     * @param position the requested index
     */
    public void insertItem(T item, int position) {
        List<T> updated = new ArrayList<>(state.items());
        int index = Math.max(0, Math.min(position, updated.size()));
        updated.add(index, item);
        publish(state.withItems(updated));
    }

    // =========================================================================
    // STATE OBSERVATION
    // =========================================================================

    /**
     * Returns the current state snapshot.
     */
    public PageState<T> state() {
        return state;
    }

    /**
     * Returns the filter the next load will use, or null.
     */
    public FilterSpec currentFilter() {
        return currentFilter;
    }

    /**
     * Returns true while a load (including a background refresh) is in flight.
     */
    public boolean isLoading() {
        return loading;
    }

    public PaginatorConfig getConfig() {
        return config;
    }

    /**
     * Registers a listener for every subsequently published snapshot.
     *
     * @param listener receives snapshots in publication order
     * @return a handle that removes the listener
     */
    public Subscription subscribe(StateListener<T> listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        if (closed) {
            listener.onClosed();
            return () -> { };
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void unsubscribe(StateListener<T> listener) {
        listeners.remove(listener);
    }

    /**
     * Closes this paginator. Listeners are told and dropped, results of loads still in
     * flight are discarded and later operations do nothing.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        generation++;
        loading = false;
        for (StateListener<T> listener : listeners) {
            listener.onClosed();
        }
        listeners.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    // =========================================================================
    // LOAD PIPELINE
    // =========================================================================

    private CompletableFuture<Void> restart() {
        loading = false;
        return loadInitial();
    }

    private long beginLoad() {
        loading = true;
        return ++generation;
    }

    private boolean isCurrent(long run) {
        return run == generation && !closed;
    }

    private CompletableFuture<Void> runLoad(long run, boolean initial) {
        FetchQuery<K> query = new FetchQuery<>(config.pageSize(), initial ? null : nextPageKey, currentFilter);

        CompletableFuture<Void> load;
        try {
            String cacheKey = CacheKeys.deriveKey(query);
            load = switch (config.cachePolicy()) {
                case CACHE_FIRST -> loadCacheFirst(run, query, cacheKey, initial);
                case NETWORK_FIRST -> loadNetworkFirst(run, query, cacheKey, initial);
                case CACHE_ONLY -> loadCacheOnly(run, query, cacheKey, initial);
                case NETWORK_ONLY -> loadNetworkOnly(run, query, initial);
            };
        } catch (RuntimeException e) {
            load = CompletableFuture.failedFuture(e);
        }

        return load.<Void>handle((v, ex) -> {
            if (ex != null && isCurrent(run)) {
                log.error("Load failed unexpectedly", unwrap(ex));
                fail(unwrap(ex));
            }
            if (run == generation) {
                loading = false;
            }
            return null;
        });
    }

    /**
     * Cache hit: publish the cached page, then refresh it in the background.
     * Cache miss: fetch, store, publish.
     */
    private CompletableFuture<Void> loadCacheFirst(long run, FetchQuery<K> query, String cacheKey, boolean initial) {
        return lookupCache(query, cacheKey)
                .exceptionally(ex -> {
                    log.warn("Cache lookup failed for {}, treating it as a miss", cacheKey, unwrap(ex));
                    return Optional.empty();
                })
                .<Void>thenCompose(cached -> {
                    if (cached.isEmpty()) {
                        log.debug("Cache miss for {}", cacheKey);
                        return fetchAndStore(run, query, cacheKey)
                                .<Void>handle((page, ex) -> {
                                    if (!isCurrent(run)) {
                                        return null;
                                    }
                                    if (ex != null) {
                                        fail(unwrap(ex));
                                    } else {
                                        applyPage(page, false, initial, List.of());
                                    }
                                    return null;
                                });
                    }
                    if (!isCurrent(run)) {
                        return done();
                    }

                    Page<T, K> cachedPage = cached.get();
                    log.debug("Cache hit for {}, refreshing in background", cacheKey);
                    applyPage(cachedPage, true, initial, List.of());
                    publish(state.withRefreshing(true));

                    return fetchAndStore(run, query, cacheKey)
                            .<Void>handle((fresh, ex) -> {
                                if (!isCurrent(run)) {
                                    return null;
                                }
                                if (ex != null) {
                                    log.warn("Background refresh failed for {}, keeping cached page",
                                            cacheKey, unwrap(ex));
                                    publish(state.withRefreshing(false).withRetryAttempt(null));
                                } else {
                                    applyPage(fresh, false, initial, cachedPage.items());
                                }
                                return null;
                            });
                });
    }

    /**
     * Fetch first; on failure fall back to the cached page, else report the fetch error.
     */
    private CompletableFuture<Void> loadNetworkFirst(long run, FetchQuery<K> query, String cacheKey, boolean initial) {
        return fetchAndStore(run, query, cacheKey)
                .<CompletableFuture<Void>>handle((page, ex) -> {
                    if (ex == null) {
                        if (isCurrent(run)) {
                            applyPage(page, false, initial, List.of());
                        }
                        return done();
                    }

                    Throwable error = unwrap(ex);
                    if (cache == null) {
                        if (isCurrent(run)) {
                            fail(error);
                        }
                        return done();
                    }

                    return lookupCache(query, cacheKey).<Void>handle((cached, lookupEx) -> {
                        if (!isCurrent(run)) {
                            return null;
                        }
                        if (lookupEx == null && cached.isPresent()) {
                            log.debug("Fetch failed ({}), serving cached page for {}", error.toString(), cacheKey);
                            applyPage(cached.get(), true, initial, List.of());
                        } else {
                            if (lookupEx != null) {
                                log.warn("Cache fallback failed for {}", cacheKey, unwrap(lookupEx));
                            }
                            fail(error);
                        }
                        return null;
                    });
                })
                .thenCompose(Function.identity());
    }

    /**
     * Serve from cache only; a missing store or a miss is an error.
     */
    private CompletableFuture<Void> loadCacheOnly(long run, FetchQuery<K> query, String cacheKey, boolean initial) {
        if (cache == null) {
            fail(new CacheUnavailableException());
            return done();
        }

        return lookupCache(query, cacheKey).<Void>handle((cached, ex) -> {
            if (!isCurrent(run)) {
                return null;
            }
            if (ex != null) {
                fail(unwrap(ex));
            } else if (cached.isPresent()) {
                applyPage(cached.get(), true, initial, List.of());
            } else {
                fail(new CacheMissException(cacheKey));
            }
            return null;
        });
    }

    /**
     * Always fetch; the cache is never touched.
     */
    private CompletableFuture<Void> loadNetworkOnly(long run, FetchQuery<K> query, boolean initial) {
        return fetch(run, query).<Void>handle((page, ex) -> {
            if (!isCurrent(run)) {
                return null;
            }
            if (ex != null) {
                fail(unwrap(ex));
            } else {
                applyPage(page, false, initial, List.of());
            }
            return null;
        });
    }

    private CompletableFuture<Page<T, K>> fetch(long run, FetchQuery<K> query) {
        CompletableFuture<Page<T, K>> fetched = retryController.execute(
                () -> source.fetch(query),
                config.retryPolicy(),
                attempt -> onContext(() -> reportRetry(run, attempt))
        );
        return onContext(fetched);
    }

    private CompletableFuture<Page<T, K>> fetchAndStore(long run, FetchQuery<K> query, String cacheKey) {
        return fetch(run, query).thenCompose(page -> store(run, query, cacheKey, page).thenApply(v -> page));
    }

    /**
     * Writes a page to the cache. A failed write is logged and otherwise ignored.
     * Pages of superseded loads are not written: a refresh may have cleared the store since.
     */
    private CompletableFuture<Void> store(long run, FetchQuery<K> query, String cacheKey, Page<T, K> page) {
        if (cache == null) {
            return done();
        }
        if (!isCurrent(run)) {
            log.debug("Discarding page of a superseded load for {}", cacheKey);
            return done();
        }
        return onContext(safely(() -> cache.put(cacheKey, query, page, config.cacheTtl())))
                .handle((v, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to cache page for {}", cacheKey, unwrap(ex));
                    }
                    return null;
                });
    }

    private CompletableFuture<Optional<Page<T, K>>> lookupCache(FetchQuery<K> query, String cacheKey) {
        if (cache == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return onContext(safely(() -> cache.get(cacheKey, query)))
                .thenApply(cached -> cached != null ? cached : Optional.<Page<T, K>>empty());
    }

    private void reportRetry(long run, int attempt) {
        if (isCurrent(run)) {
            log.debug("Retry attempt {}", attempt);
            publish(state.withRetryAttempt(attempt));
        }
    }

    /**
     * Folds a page into the item list: replaces it on an initial load, otherwise appends.
     * On append the {@code superseded} items (the cached copy of the same page) are removed
     * first, matched by identity, so local edits made meanwhile survive.
     */
    private void applyPage(Page<T, K> page, boolean fromCache, boolean initial, List<T> superseded) {
        List<T> items;
        if (initial) {
            items = page.items();
        } else {
            items = withoutSuperseded(state.items(), superseded);
            items.addAll(page.items());
        }
        nextPageKey = page.nextKey();
        publish(PageState.ready(items, !page.isLast(), fromCache, false));
    }

    /**
     * Removes one occurrence of each superseded element, scanning from the end where
     * the cached page was appended.
     */
    private static <T> List<T> withoutSuperseded(List<T> current, List<T> superseded) {
        if (superseded.isEmpty()) {
            return new ArrayList<>(current);
        }
        Map<T, Integer> pending = new IdentityHashMap<>();
        for (T item : superseded) {
            pending.merge(item, 1, Integer::sum);
        }
        List<T> kept = new ArrayList<>(current.size());
        for (int i = current.size() - 1; i >= 0; i--) {
            T item = current.get(i);
            Integer count = pending.get(item);
            if (count != null) {
                if (count == 1) {
                    pending.remove(item);
                } else {
                    pending.put(item, count - 1);
                }
                continue;
            }
            kept.add(item);
        }
        Collections.reverse(kept);
        return kept;
    }

    private void fail(Throwable error) {
        log.debug("Load failed: {}", error.toString());
        publish(state.failed(error));
    }

    private void publish(PageState<T> next) {
        state = next;
        for (StateListener<T> listener : listeners) {
            try {
                listener.onStateChanged(next);
            } catch (RuntimeException e) {
                log.error("State listener {} failed", listener, e);
            }
        }
    }

    // =========================================================================
    // EXECUTION CONTEXT
    // =========================================================================

    private <R> CompletableFuture<R> onContext(CompletableFuture<R> future) {
        if (context == null) {
            return future;
        }
        return future.whenCompleteAsync((r, ex) -> { }, context);
    }

    private void onContext(Runnable action) {
        if (context == null) {
            action.run();
        } else {
            context.execute(action);
        }
    }

    private static <R> CompletableFuture<R> safely(Supplier<CompletableFuture<R>> call) {
        try {
            CompletableFuture<R> future = call.get();
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }

    // =========================================================================
    // EXCEPTIONS
    // =========================================================================

    /**
     * Thrown into the state when {@link CachePolicy#CACHE_ONLY} is used without a cache store.
     */
    public static class CacheUnavailableException extends PaginationException {
        public CacheUnavailableException() {
            super("Cache-only policy requires a cache store to be configured");
        }
    }

    /**
     * Thrown into the state when {@link CachePolicy#CACHE_ONLY} finds nothing for the query.
     */
    public static class CacheMissException extends PaginationException {
        private final String cacheKey;

        public CacheMissException(String cacheKey) {
            super("No cached data available for this query");
            this.cacheKey = cacheKey;
        }

        public String getCacheKey() {
            return cacheKey;
        }
    }
}
