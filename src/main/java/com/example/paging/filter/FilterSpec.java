package com.example.paging.filter;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter conditions and sort order for a query, interpreted by the backend.
 *
 * <p>Two specs are equal iff their filter and sort sequences are element-wise equal,
 * order included. Cache keys rely on this, so different filters never share
 * cache entries.
 *
 * <pre>{@code
 * FilterSpec spec = FilterSpec.empty()
 *     .where(FilterField.of("status", "active"))
 *     .where(FilterField.of("price", 100, StandardOperation.GREATER_THAN))
 *     .orderBy(SortField.desc("createdAt"));
 * }</pre>
 */
public record FilterSpec(
        List<FilterField> filters,
        List<SortField> sorts
) {
    public FilterSpec {
        filters = filters != null ? List.copyOf(filters) : List.of();
        sorts = sorts != null ? List.copyOf(sorts) : List.of();
    }

    public static FilterSpec empty() {
        return new FilterSpec(List.of(), List.of());
    }

    public static FilterSpec of(List<FilterField> filters, List<SortField> sorts) {
        return new FilterSpec(filters, sorts);
    }

    /**
     * Returns a copy with the given condition appended.
     */
    public FilterSpec where(FilterField filter) {
        List<FilterField> next = new ArrayList<>(filters);
        next.add(filter);
        return new FilterSpec(next, sorts);
    }

    /**
     * Returns a copy with the given sort key appended (lowest priority so far).
     */
    public FilterSpec orderBy(SortField sort) {
        List<SortField> next = new ArrayList<>(sorts);
        next.add(sort);
        return new FilterSpec(filters, next);
    }

    public boolean isEmpty() {
        return filters.isEmpty() && sorts.isEmpty();
    }
}
