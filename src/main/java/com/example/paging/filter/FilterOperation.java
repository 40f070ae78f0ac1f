package com.example.paging.filter;

import java.util.Objects;

/**
 * Comparison applied by a {@link FilterField}.
 *
 * <p>The thirteen common operations are the constants of {@link StandardOperation};
 * anything backend-specific (Firestore {@code array-contains}, SQL {@code ILIKE},
 * Mongo {@code $regex}, ...) goes through {@link Custom}. Backends switch over
 * {@link StandardOperation} and fall back to {@link #code()} for custom ones:
 *
 * <pre>{@code
 * if (field.operation() instanceof StandardOperation op) {
 *     switch (op) {
 *         case EQUALS -> ...;
 *         case GREATER_THAN -> ...;
 *         ...
 *     }
 * } else {
 *     applyNative(field.operation().code(), field);
 * }
 * }</pre>
 */
public sealed interface FilterOperation permits StandardOperation, FilterOperation.Custom {

    /**
     * Returns the stable code of this operation.
     */
    String code();

    /**
     * Creates a backend-specific operation.
     */
    static FilterOperation custom(String code) {
        return new Custom(code);
    }

    /**
     * Backend-specific operation carrying an opaque code.
     * Never equal to a {@link StandardOperation}, even when the codes match.
     */
    record Custom(String code) implements FilterOperation {
        public Custom {
            Objects.requireNonNull(code, "code must not be null");
        }

        @Override
        public String toString() {
            return "custom(" + code + ")";
        }
    }
}
