package com.ryuqq.recordgraph.testkit.fault;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.query.QueryMatch;
import com.ryuqq.recordgraph.core.query.QueryPredicate;
import com.ryuqq.recordgraph.core.query.QueryRequest;
import com.ryuqq.recordgraph.core.query.QueryResult;
import com.ryuqq.recordgraph.core.spi.Store;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link FaultInjectingStore}.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class FaultInjectingStoreTest {

    @Mock
    private Store delegate;

    private FaultInjectingStore store;

    @BeforeEach
    void setUp() {
        store = new FaultInjectingStore(delegate);
    }

    @Test
    void failNextSave_fails_once_then_delegates() {
        // given
        StoredRecord record = StoredRecord.builder("Item").build();
        when(delegate.save(record)).thenReturn(CompletableFuture.completedFuture(record));
        store.failNextSave(new IllegalStateException("disk full"));

        // when
        CompletableFuture<StoredRecord> first = store.save(record);
        CompletableFuture<StoredRecord> second = store.save(record);

        // then
        assertThat(first).isCompletedExceptionally();
        assertThat(second.join()).isSameAs(record);
        assertThat(store.saveCount()).isEqualTo(2);
    }

    @Test
    void failFetch_fails_every_fetch_of_that_identity() {
        // given
        store.failFetch(Identity.of("a"), new IllegalStateException("unreachable"));

        // when
        CompletableFuture<StoredRecord> first = store.fetch(Identity.of("a"));
        CompletableFuture<StoredRecord> second = store.fetch(Identity.of("a"));

        // then
        assertThat(first).isCompletedExceptionally();
        assertThat(second).isCompletedExceptionally();
        assertThat(store.fetchCount(Identity.of("a"))).isEqualTo(2);
        assertThat(store.fetchCount()).isEqualTo(2);
        verify(delegate, never()).fetch(any());
    }

    @Test
    void failMatch_turns_successful_match_into_failure() {
        // given
        StoredRecord a = StoredRecord.builder("Item").identity(Identity.of("a")).build();
        StoredRecord b = StoredRecord.builder("Item").identity(Identity.of("b")).build();
        QueryRequest request = QueryRequest.first("Item", QueryPredicate.all(), List.of(), 10);
        when(delegate.query(request)).thenReturn(CompletableFuture.completedFuture(
            QueryResult.lastPage(List.of(QueryMatch.success(a), QueryMatch.success(b)))));
        store.failMatch(Identity.of("b"), new IllegalStateException("corrupt"));

        // when
        QueryResult result = store.query(request).join();

        // then
        assertThat(result.matches()).hasSize(2);
        assertThat(result.matches().get(0).isSuccess()).isTrue();
        assertThat(result.matches().get(1).isSuccess()).isFalse();
        assertThat(result.matches().get(1).errorOrNull()).hasMessage("corrupt");
    }

    @Test
    void failNextQuery_skips_delegate() {
        // given
        store.failNextQuery(new IllegalStateException("offline"));

        // when
        CompletableFuture<QueryResult> result =
            store.query(QueryRequest.first("Item", QueryPredicate.all(), List.of(), 10));

        // then
        assertThat(result).isCompletedExceptionally();
        assertThat(store.queryCount()).isEqualTo(1);
        verify(delegate, never()).query(any());
    }

    @Test
    void reset_clears_counters_and_faults() {
        // given
        when(delegate.fetch(Identity.of("a"))).thenReturn(CompletableFuture.completedFuture(
            StoredRecord.builder("Item").identity(Identity.of("a")).build()));
        store.failFetch(Identity.of("a"), new IllegalStateException("unreachable"));
        store.fetch(Identity.of("a"));

        // when
        store.reset();

        // then
        assertThat(store.fetchCount()).isZero();
        assertThat(store.fetch(Identity.of("a")).join().getIdentity()).contains(Identity.of("a"));
    }

    @Test
    void constructor_rejects_null_delegate() {
        assertThatThrownBy(() -> new FaultInjectingStore(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("delegate");
    }
}
