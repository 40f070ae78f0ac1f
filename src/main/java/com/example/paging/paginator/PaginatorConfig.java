package com.example.paging.paginator;

import com.example.paging.filter.FilterSpec;
import com.example.paging.retry.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link Paginator}.
 *
 * @param pageSize number of items requested per page
 * @param cachePolicy how loads combine cache and source
 * @param retryPolicy retry applied to every fetch; null means {@link RetryPolicy#none()}
 * @param initialFilter filter used until {@link Paginator#updateFilter} replaces it, may be null
 * @param cacheTtl time-to-live passed to every cache write, null for entries that never expire
 */
public record PaginatorConfig(
        int pageSize,
        CachePolicy cachePolicy,
        RetryPolicy retryPolicy,
        FilterSpec initialFilter,
        Duration cacheTtl
) {
    public static final int DEFAULT_PAGE_SIZE = 20;

    public PaginatorConfig {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, got: " + pageSize);
        }
        Objects.requireNonNull(cachePolicy, "cachePolicy must not be null");
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.none();
        if (cacheTtl != null && cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must not be negative, got: " + cacheTtl);
        }
    }

    public static PaginatorConfig defaults() {
        return new PaginatorConfig(DEFAULT_PAGE_SIZE, CachePolicy.CACHE_FIRST, RetryPolicy.none(), null, null);
    }

    public PaginatorConfig withPageSize(int pageSize) {
        return new PaginatorConfig(pageSize, cachePolicy, retryPolicy, initialFilter, cacheTtl);
    }

    public PaginatorConfig withCachePolicy(CachePolicy cachePolicy) {
        return new PaginatorConfig(pageSize, cachePolicy, retryPolicy, initialFilter, cacheTtl);
    }

    public PaginatorConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new PaginatorConfig(pageSize, cachePolicy, retryPolicy, initialFilter, cacheTtl);
    }

    public PaginatorConfig withInitialFilter(FilterSpec initialFilter) {
        return new PaginatorConfig(pageSize, cachePolicy, retryPolicy, initialFilter, cacheTtl);
    }

    public PaginatorConfig withCacheTtl(Duration cacheTtl) {
        return new PaginatorConfig(pageSize, cachePolicy, retryPolicy, initialFilter, cacheTtl);
    }
}
