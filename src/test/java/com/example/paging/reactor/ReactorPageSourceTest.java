package com.example.paging.reactor;

import com.example.paging.cache.MemoryCacheStore;
import com.example.paging.model.FetchQuery;
import com.example.paging.model.Page;
import com.example.paging.paginator.CachePolicy;
import com.example.paging.paginator.Paginator;
import com.example.paging.paginator.PaginatorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ReactorPageSource: Mono-based fetchers behind the PageSource contract.
 */
class ReactorPageSourceTest {

    private static final FetchQuery<String> FIRST = FetchQuery.first(2, null);

    @Test
    @DisplayName("Should emit the page produced by the Mono")
    void shouldEmitPage() {
        ReactorPageSource<String, String> source = new ReactorPageSource<>(query ->
                Mono.just(Page.of(List.of("a", "b"), "cursor-2")));

        StepVerifier.create(source.fetchMono(FIRST))
                .assertNext(page -> {
                    assertThat(page.items()).containsExactly("a", "b");
                    assertThat(page.nextKey()).isEqualTo("cursor-2");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fail when the Mono completes empty")
    void shouldFailOnEmpty() {
        ReactorPageSource<String, String> source = new ReactorPageSource<>(query -> Mono.empty());

        StepVerifier.create(source.fetchMono(FIRST))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    @DisplayName("Should defer the fetch until subscription")
    void shouldBeLazy() {
        AtomicReference<FetchQuery<String>> seen = new AtomicReference<>();
        ReactorPageSource<String, String> source = new ReactorPageSource<>(query -> {
            seen.set(query);
            return Mono.just(Page.<String, String>last(List.of()));
        });

        Mono<Page<String, String>> mono = source.fetchMono(FIRST);
        assertThat(seen.get()).isNull();

        mono.block();
        assertThat(seen.get()).isEqualTo(FIRST);
    }

    @Test
    @DisplayName("Should run blocking fetchers off the calling thread")
    void shouldRunBlockingFetcherOnElasticScheduler() throws Exception {
        AtomicReference<String> thread = new AtomicReference<>();
        ReactorPageSource<String, String> source = ReactorPageSource.fromBlocking(query -> {
            thread.set(Thread.currentThread().getName());
            return Page.last(List.of("x"));
        });

        Page<String, String> page = source.fetch(FIRST).get(5, TimeUnit.SECONDS);

        assertThat(page.items()).containsExactly("x");
        assertThat(thread.get()).startsWith("boundedElastic");
    }

    @Test
    @DisplayName("Should surface fetcher errors through the future")
    void shouldPropagateErrors() {
        ReactorPageSource<String, String> source = new ReactorPageSource<>(query ->
                Mono.error(new IllegalArgumentException("bad cursor")));

        assertThatThrownBy(() -> source.fetch(FIRST).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should drive a paginator end to end")
    void shouldDrivePaginator() {
        ReactorPageSource<String, String> source = new ReactorPageSource<>(query ->
                Mono.just(query.pageKey() == null
                        ? Page.<String, String>of(List.of("a", "b"), "p2")
                        : Page.<String, String>last(List.of("c"))));
        Paginator<String, String> paginator = new Paginator<>(source, null,
                PaginatorConfig.defaults().withPageSize(2).withCachePolicy(CachePolicy.NETWORK_ONLY));

        paginator.loadInitial().join();
        paginator.loadNext().join();

        assertThat(paginator.state().items()).containsExactly("a", "b", "c");
        assertThat(paginator.state().hasMore()).isFalse();
    }

    @Test
    @DisplayName("Should finish loads completed on scheduler threads without a context executor")
    void shouldDrivePaginatorFromSchedulerThreads() throws Exception {
        // Given: Fetches complete on boundedElastic threads, no context executor
        ReactorPageSource<String, String> source = ReactorPageSource.fromBlocking(query ->
                query.pageKey() == null
                        ? Page.<String, String>of(List.of("a", "b"), "p2")
                        : Page.<String, String>last(List.of("c")));
        Paginator<String, String> paginator = new Paginator<>(source, new MemoryCacheStore<>(),
                PaginatorConfig.defaults().withPageSize(2));

        // When
        paginator.loadInitial().get(5, TimeUnit.SECONDS);
        paginator.loadNext().get(5, TimeUnit.SECONDS);

        // Then: The calling thread sees the guard released and both pages applied
        assertThat(paginator.isLoading()).isFalse();
        assertThat(paginator.state().items()).containsExactly("a", "b", "c");
        assertThat(paginator.state().hasMore()).isFalse();
    }
}
