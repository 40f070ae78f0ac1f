package com.example.paging.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Configuration for retry behavior.
 *
 * <p>{@code maxAttempts} is the total number of fetch attempts; 0 and 1 both mean a single
 * attempt without retry. The first wait is {@code initialDelay} as given; later waits double
 * and are capped at {@code maxDelay}: {@code d, min(2d, max), min(4d, max), ...}. When
 * {@code retryIf} is set, only failures it accepts are retried.
 *
 * <pre>{@code
 * RetryPolicy.defaults()                                   // 3 attempts, 1s, 2s
 * RetryPolicy.exponential(5, Duration.ofMillis(200))       // 5 attempts, 200ms doubling
 * RetryPolicy.defaults().withRetryIf(e -> e instanceof IOException)
 * }</pre>
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        Predicate<Throwable> retryIf
) {
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    public RetryPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got: " + maxAttempts);
        }
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        this(maxAttempts, initialDelay, maxDelay, null);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), DEFAULT_MAX_DELAY);
    }

    /**
     * A single attempt, failures are never retried.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, DEFAULT_MAX_DELAY);
    }

    public RetryPolicy withRetryIf(Predicate<Throwable> retryIf) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, retryIf);
    }

    /**
     * Returns true if the failure of the given 0-based attempt should be retried.
     */
    public boolean shouldRetry(int attempt, Throwable error) {
        return attempt + 1 < maxAttempts && (retryIf == null || retryIf.test(error));
    }

    /**
     * Returns the delay that follows {@code delay} in the backoff sequence.
     */
    public Duration nextDelay(Duration delay) {
        Duration doubled = delay.multipliedBy(2);
        return doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
    }
}
