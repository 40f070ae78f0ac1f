package com.example.paging.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Runs an asynchronous action with bounded exponential-backoff retry.
 *
 * <p>Attempt 0 runs immediately. After a failure the policy decides whether to retry;
 * if so the controller waits the current delay, reports the retry number (1, 2, ...)
 * to the {@code onRetry} callback and runs the action again. When the budget is
 * exhausted or the predicate rejects the failure, the returned future fails with the
 * last error, unwrapped from any {@link CompletionException}.
 *
 * <pre>{@code
 * RetryController retry = new RetryController();
 * retry.execute(() -> source.fetch(query), RetryPolicy.defaults(), n -> log.info("retry {}", n))
 *     .thenAccept(page -> ...);
 * }</pre>
 */
public class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final BackoffScheduler scheduler;

    public RetryController() {
        this(BackoffScheduler.system());
    }

    public RetryController(BackoffScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /**
     * Runs the action, retrying failures according to the policy.
     *
     * @param action supplies a fresh attempt each time it is called
     * @param policy retry configuration
     * @param onRetry called with the retry number just before each retry
     * @return a CompletableFuture with the first successful result or the last failure
     */
    public <R> CompletableFuture<R> execute(
            Supplier<CompletableFuture<R>> action,
            RetryPolicy policy,
            IntConsumer onRetry
    ) {
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        return executeWithRetryAsync(action, policy, onRetry, 0, policy.initialDelay());
    }

    private <R> CompletableFuture<R> executeWithRetryAsync(
            Supplier<CompletableFuture<R>> action,
            RetryPolicy policy,
            IntConsumer onRetry,
            int attempt,
            Duration delay
    ) {
        return attempt(action).exceptionallyCompose(ex -> {
            Throwable cause = unwrap(ex);

            if (!policy.shouldRetry(attempt, cause)) {
                if (attempt > 0) {
                    log.debug("Giving up after {} attempts: {}", attempt + 1, cause.toString());
                }
                return CompletableFuture.failedFuture(cause);
            }

            int next = attempt + 1;
            log.debug("Attempt {} failed ({}), retrying in {} ms", attempt, cause.toString(), delay.toMillis());
            return scheduler.delay(delay).thenCompose(v -> {
                if (onRetry != null) {
                    onRetry.accept(next);
                }
                return executeWithRetryAsync(action, policy, onRetry, next, policy.nextDelay(delay));
            });
        });
    }

    private static <R> CompletableFuture<R> attempt(Supplier<CompletableFuture<R>> action) {
        try {
            CompletableFuture<R> future = action.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new NullPointerException("action returned a null future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Strips the {@link CompletionException}/{@link ExecutionException} layers added by
     * future composition.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
