package com.example.paging.paginator;

/**
 * How a load combines the cache store and the page source.
 */
public enum CachePolicy {

    /**
     * Show the cached page immediately, then fetch in the background and replace it.
     * Falls back to a foreground fetch on a cache miss.
     */
    CACHE_FIRST,

    /**
     * Fetch first; on failure serve the cached page if there is one.
     */
    NETWORK_FIRST,

    /**
     * Serve from the cache only and never fetch (offline mode).
     */
    CACHE_ONLY,

    /**
     * Always fetch; the cache is neither read nor written.
     */
    NETWORK_ONLY
}
