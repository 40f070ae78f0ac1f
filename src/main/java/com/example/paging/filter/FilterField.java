package com.example.paging.filter;

import java.util.Objects;

/**
 * A single filter condition: which field, what value, which comparison.
 *
 * <p>The value may be anything the backend understands: a string, a number,
 * a list for {@link StandardOperation#IS_IN}, or null for null checks.
 */
public record FilterField(
        String fieldName,
        Object value,
        FilterOperation operation
) {
    public FilterField {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
    }

    /**
     * Creates an equality condition.
     */
    public static FilterField of(String fieldName, Object value) {
        return new FilterField(fieldName, value, StandardOperation.EQUALS);
    }

    public static FilterField of(String fieldName, Object value, FilterOperation operation) {
        return new FilterField(fieldName, value, operation);
    }

    public static FilterField isNull(String fieldName) {
        return new FilterField(fieldName, null, StandardOperation.IS_NULL);
    }

    public static FilterField isNotNull(String fieldName) {
        return new FilterField(fieldName, null, StandardOperation.IS_NOT_NULL);
    }
}
