package com.ryuqq.recordgraph.application.support;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Futures 유닛 테스트.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
class FuturesTest {

    @Test
    void unwrap_중첩된_래핑을_모두_벗김() {
        IllegalStateException root = new IllegalStateException("root");

        Throwable unwrapped = Futures.unwrap(new CompletionException(new ExecutionException(root)));

        assertThat(unwrapped).isSameAs(root);
    }

    @Test
    void unwrap_원인_없는_CompletionException은_그대로() {
        CompletionException bare = new CompletionException("bare", null);

        assertThat(Futures.unwrap(bare)).isSameAs(bare);
    }

    @Test
    void attempt_동기_예외를_실패_future로_변환() {
        // when
        CompletableFuture<String> future = Futures.attempt(() -> {
            throw new IllegalArgumentException("bad input");
        });

        // then
        CompletionException error = catchThrowableOfType(future::join, CompletionException.class);
        assertThat(error.getCause())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("bad input");
    }

    @Test
    void unwrapped_후속_단계의_래핑을_제거() {
        // given
        IllegalStateException root = new IllegalStateException("stage failed");
        CompletableFuture<String> chained = CompletableFuture.completedFuture("x")
            .thenApply(value -> {
                throw root;
            });

        // when
        CompletableFuture<String> result = Futures.unwrapped(chained);

        // then
        CompletionException error = catchThrowableOfType(result::join, CompletionException.class);
        assertThat(error.getCause()).isSameAs(root);
    }

    @Test
    void unwrapped_성공은_같은_값() {
        assertThat(Futures.unwrapped(CompletableFuture.completedFuture(7)).join()).isEqualTo(7);
    }
}
