package com.example.paging.cache;

import com.example.paging.model.Page;

import java.time.Instant;
import java.util.Objects;

/**
 * A cached page and the instant it stops being valid (null: never).
 */
public record CacheEntry<T, K>(
        Page<T, K> page,
        Instant expiresAt
) {
    public CacheEntry {
        Objects.requireNonNull(page, "page must not be null");
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
