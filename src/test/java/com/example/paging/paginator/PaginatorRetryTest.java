package com.example.paging.paginator;

import com.example.paging.model.Page;
import com.example.paging.model.PageState;
import com.example.paging.model.PageStatus;
import com.example.paging.retry.RetryController;
import com.example.paging.retry.RetryPolicy;
import com.example.paging.testing.CountingPageSource;
import com.example.paging.testing.RecordingBackoffScheduler;
import com.example.paging.testing.RecordingListener;
import com.example.paging.testing.TestItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for retry inside the paginator: attempt reporting, exhaustion and the
 * single-attempt default.
 */
class PaginatorRetryTest {

    private RecordingBackoffScheduler scheduler;
    private RecordingListener<TestItem> listener;

    @BeforeEach
    void setUp() {
        scheduler = new RecordingBackoffScheduler();
        listener = new RecordingListener<>();
    }

    private static CountingPageSource<TestItem, Integer> failingTimes(int failures) {
        AtomicInteger calls = new AtomicInteger();
        return new CountingPageSource<>(query -> calls.incrementAndGet() <= failures
                ? CompletableFuture.failedFuture(new IOException("attempt " + calls.get()))
                : CompletableFuture.completedFuture(Page.of(List.of(TestItem.of(1)), 2)));
    }

    private Paginator<TestItem, Integer> paginator(CountingPageSource<TestItem, Integer> source, RetryPolicy policy) {
        PaginatorConfig config = PaginatorConfig.defaults()
                .withCachePolicy(CachePolicy.NETWORK_ONLY)
                .withRetryPolicy(policy);
        Paginator<TestItem, Integer> paginator = new Paginator<>(source, null, config, new RetryController(scheduler), null);
        paginator.subscribe(listener);
        return paginator;
    }

    @Test
    @DisplayName("Should publish each retry attempt before succeeding")
    void shouldPublishRetryAttempts() {
        // Given: Two failures, 3 attempts allowed
        CountingPageSource<TestItem, Integer> source = failingTimes(2);
        Paginator<TestItem, Integer> paginator = paginator(source, RetryPolicy.exponential(3, Duration.ofMillis(100)));

        // When
        paginator.loadInitial().join();

        // Then: Attempts 1 and 2 were visible, final state is clean
        List<Integer> attempts = listener.getStates().stream()
                .map(PageState::retryAttempt)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        assertThat(attempts).containsExactly(1, 2);
        assertThat(paginator.state().status()).isEqualTo(PageStatus.READY);
        assertThat(paginator.state().retryAttempt()).isNull();
        assertThat(source.getFetchCount()).isEqualTo(3);
        assertThat(scheduler.getDelays()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    @DisplayName("Should report the last error once retries are exhausted")
    void shouldFailAfterExhaustion() {
        CountingPageSource<TestItem, Integer> source = failingTimes(Integer.MAX_VALUE);
        Paginator<TestItem, Integer> paginator = paginator(source, RetryPolicy.exponential(2, Duration.ofMillis(10)));

        paginator.loadInitial().join();

        assertThat(source.getFetchCount()).isEqualTo(2);
        assertThat(paginator.state().status()).isEqualTo(PageStatus.ERROR);
        assertThat(paginator.state().error()).isInstanceOf(IOException.class).hasMessage("attempt 2");
        assertThat(paginator.state().retryAttempt()).isNull();
    }

    @Test
    @DisplayName("Should make a single attempt by default")
    void shouldNotRetryByDefault() {
        CountingPageSource<TestItem, Integer> source = failingTimes(1);
        Paginator<TestItem, Integer> paginator = new Paginator<>(source, null,
                PaginatorConfig.defaults().withCachePolicy(CachePolicy.NETWORK_ONLY));

        paginator.loadInitial().join();

        assertThat(source.getFetchCount()).isEqualTo(1);
        assertThat(paginator.state().hasError()).isTrue();
        assertThat(paginator.getConfig().retryPolicy()).isEqualTo(RetryPolicy.none());
    }
}
