package com.example.paging.filter;

import java.util.Objects;

/**
 * One sort key. Several sort fields form a priority order, first one wins.
 */
public record SortField(
        String fieldName,
        boolean descending
) {
    public SortField {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
    }

    public static SortField asc(String fieldName) {
        return new SortField(fieldName, false);
    }

    public static SortField desc(String fieldName) {
        return new SortField(fieldName, true);
    }
}
