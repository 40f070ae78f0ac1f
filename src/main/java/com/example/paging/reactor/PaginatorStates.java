package com.example.paging.reactor;

import com.example.paging.model.PageState;
import com.example.paging.model.PageStatus;
import com.example.paging.paginator.Paginator;
import com.example.paging.paginator.StateListener;
import com.example.paging.paginator.Subscription;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.List;

/**
 * Exposes a {@link Paginator}'s state changes as a {@link Flux}.
 *
 * <p>Each subscriber first receives the current snapshot, then every snapshot the
 * paginator publishes. The Flux completes when the paginator is closed; cancelling
 * the subscription unsubscribes from the paginator.
 *
 * <pre>{@code
 * PaginatorStates.flux(paginator)
 *     .filter(state -> state.status() == PageStatus.READY)
 *     .map(PageState::items)
 *     .subscribe(this::render);
 * }</pre>
 */
public final class PaginatorStates {

    private PaginatorStates() {
    }

    /**
     * Returns the current state followed by every published state.
     */
    public static <T> Flux<PageState<T>> flux(Paginator<T, ?> paginator) {
        return Flux.create(sink -> {
            Subscription subscription = paginator.subscribe(new SinkListener<>(sink));
            sink.onDispose(subscription::unsubscribe);
            if (!paginator.isClosed()) {
                sink.next(paginator.state());
            }
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    /**
     * Returns the item lists of the snapshots that finished a load successfully.
     */
    public static <T> Flux<List<T>> readyItems(Paginator<T, ?> paginator) {
        return flux(paginator)
                .filter(state -> state.status() == PageStatus.READY)
                .map(PageState::items);
    }

    private static final class SinkListener<T> implements StateListener<T> {
        private final FluxSink<PageState<T>> sink;

        SinkListener(FluxSink<PageState<T>> sink) {
            this.sink = sink;
        }

        @Override
        public void onStateChanged(PageState<T> state) {
            sink.next(state);
        }

        @Override
        public void onClosed() {
            sink.complete();
        }
    }
}
