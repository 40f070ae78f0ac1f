package com.example.paging.filter;

/**
 * The common filter operations every backend is expected to understand.
 */
public enum StandardOperation implements FilterOperation {
    EQUALS("equals"),
    NOT_EQUALS("notEquals"),
    GREATER_THAN("greaterThan"),
    GREATER_THAN_OR_EQUAL("greaterThanOrEqual"),
    LESS_THAN("lessThan"),
    LESS_THAN_OR_EQUAL("lessThanOrEqual"),
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    IS_IN("isIn"),
    IS_NOT_IN("isNotIn"),
    IS_NULL("isNull"),
    IS_NOT_NULL("isNotNull");

    private final String code;

    StandardOperation(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    /**
     * Returns true for operations that ignore the filter value.
     */
    public boolean isNullCheck() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    @Override
    public String toString() {
        return code;
    }
}
