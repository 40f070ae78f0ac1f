package com.example.paging.paginator;

import com.example.paging.model.PageStatus;
import com.example.paging.testing.CountingPageSource;
import com.example.paging.testing.RecordingListener;
import com.example.paging.testing.TestItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for local list mutations. None of them touch the source or the cache;
 * every one publishes a new snapshot.
 */
class PaginatorMutationTest {

    private CountingPageSource<TestItem, Integer> source;
    private Paginator<TestItem, Integer> paginator;
    private RecordingListener<TestItem> listener;

    @BeforeEach
    void setUp() {
        source = CountingPageSource.endlessPairs();
        paginator = new Paginator<>(source, null,
                PaginatorConfig.defaults().withPageSize(2).withCachePolicy(CachePolicy.NETWORK_ONLY));
        listener = new RecordingListener<>();
    }

    private void loadTwoItems() {
        paginator.loadInitial().join();
        paginator.subscribe(listener);
    }

    private List<Integer> ids() {
        return paginator.state().items().stream().map(TestItem::id).collect(Collectors.toList());
    }

    // =========================================================================
    // INSERT
    // =========================================================================

    @Test
    @DisplayName("Should insert at the top by default")
    void shouldInsertAtTop() {
        loadTwoItems();

        paginator.insertItem(TestItem.of(9));

        assertThat(ids()).containsExactly(9, 0, 1);
        assertThat(listener.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should clamp an out-of-range position to the end")
    void shouldClampPosition() {
        loadTwoItems();

        paginator.insertItem(TestItem.of(9), 999);
        paginator.insertItem(TestItem.of(8), -5);

        assertThat(ids()).containsExactly(8, 0, 1, 9);
    }

    @Test
    @DisplayName("Should insert into an empty list before any load")
    void shouldInsertIntoEmptyList() {
        paginator.subscribe(listener);

        paginator.insertItem(TestItem.of(5));

        assertThat(ids()).containsExactly(5);
        assertThat(paginator.state().status()).isEqualTo(PageStatus.IDLE);
        assertThat(source.getFetchCount()).isZero();
    }

    // =========================================================================
    // UPDATE AND REMOVE
    // =========================================================================

    @Test
    @DisplayName("Should replace matching items in place")
    void shouldUpdateMatchingItem() {
        loadTwoItems();

        paginator.updateItem(new TestItem(1, "renamed"), item -> item.id() == 1);

        assertThat(paginator.state().items()).containsExactly(TestItem.of(0), new TestItem(1, "renamed"));
    }

    @Test
    @DisplayName("Should still publish when nothing matches")
    void shouldPublishOnNoMatch() {
        loadTwoItems();

        paginator.updateItem(TestItem.of(42), item -> item.id() == 42);

        assertThat(listener.count()).isEqualTo(1);
        assertThat(ids()).containsExactly(0, 1);
    }

    @Test
    @DisplayName("Should remove matching items and keep the rest in order")
    void shouldRemoveMatchingItems() {
        loadTwoItems();
        paginator.loadNext().join();

        paginator.removeItem(item -> item.id() % 2 == 0);

        assertThat(ids()).containsExactly(1, 3);
        assertThat(paginator.state().status()).isEqualTo(PageStatus.READY);
        assertThat(paginator.state().hasMore()).isTrue();
    }

    @Test
    @DisplayName("Should not affect paging: the next page continues from the loaded key")
    void shouldKeepNextKeyAfterMutation() {
        loadTwoItems();
        paginator.removeItem(item -> true);

        paginator.loadNext().join();

        assertThat(ids()).containsExactly(2, 3);
    }
}
