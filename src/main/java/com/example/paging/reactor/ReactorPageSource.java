package com.example.paging.reactor;

import com.example.paging.model.FetchQuery;
import com.example.paging.model.Page;
import com.example.paging.source.PageSource;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Adapts a reactive fetch function returning {@link Mono} to the {@link PageSource} contract.
 *
 * <p>Example usage:
 * <pre>{@code
 * PageSource<Product, String> source = new ReactorPageSource<>(query ->
 *     webClient.get()
 *         .uri(b -> b.path("/products").queryParam("cursor", query.pageKey()).build())
 *         .retrieve()
 *         .bodyToMono(ProductPage.class)
 *         .map(ProductPage::toPage));
 * }</pre>
 *
 * <p>An empty Mono is treated as a failure: a fetch always yields a page.
 *
 * @param <T> the type of items
 * @param <K> the type of the page key
 */
public class ReactorPageSource<T, K> implements PageSource<T, K> {

    private final Function<FetchQuery<K>, Mono<Page<T, K>>> fetcher;

    /**
     * Creates a source from a reactive fetch function.
     *
     * @param fetcher function that emits the page for a query
     */
    public ReactorPageSource(Function<FetchQuery<K>, Mono<Page<T, K>>> fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
    }

    /**
     * Wraps a blocking fetch function. The call runs on the bounded elastic scheduler,
     * which is designed for blocking I/O.
     *
     * @param blockingFetcher function that fetches a page, blocking the calling thread
     * @return a non-blocking source
     */
    public static <T, K> ReactorPageSource<T, K> fromBlocking(Function<FetchQuery<K>, Page<T, K>> blockingFetcher) {
        return fromBlocking(blockingFetcher, Schedulers.boundedElastic());
    }

    public static <T, K> ReactorPageSource<T, K> fromBlocking(
            Function<FetchQuery<K>, Page<T, K>> blockingFetcher,
            Scheduler scheduler
    ) {
        Objects.requireNonNull(blockingFetcher, "blockingFetcher must not be null");
        return new ReactorPageSource<>(query -> {
            Callable<Page<T, K>> call = () -> blockingFetcher.apply(query);
            return Mono.fromCallable(call).subscribeOn(scheduler);
        });
    }

    /**
     * Fetches a page reactively.
     *
     * @param query the query to fetch
     * @return Mono that emits the fetched page
     */
    public Mono<Page<T, K>> fetchMono(FetchQuery<K> query) {
        return Mono.defer(() -> fetcher.apply(query))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                        "Fetch completed without a page for " + query)));
    }

    @Override
    public CompletableFuture<Page<T, K>> fetch(FetchQuery<K> query) {
        return fetchMono(query).toFuture();
    }
}
