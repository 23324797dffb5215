package com.ryuqq.recordgraph.application.support;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * CompletableFuture 보조 함수.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class Futures {

    private Futures() {
    }

    /**
     * CompletionException/ExecutionException 래핑을 벗긴 원인 예외.
     *
     * @param error 예외
     * @return 원래 예외
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 원인 예외를 그대로 담은 실패 future.
     */
    public static <T> CompletableFuture<T> failed(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(unwrap(error));
        return future;
    }

    /**
     * 동기 코드를 실행해 결과 future를 반환 (예외는 실패 future로 변환).
     */
    public static <T> CompletableFuture<T> attempt(Supplier<CompletableFuture<T>> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            return failed(e);
        }
    }

    /**
     * 같은 결과로 완료되지만 실패 원인이 래핑되지 않은 future.
     *
     * <p>호출자에게 돌려주는 future는 이 함수를 거쳐 도메인 예외를 직접 노출합니다.</p>
     */
    public static <T> CompletableFuture<T> unwrapped(CompletableFuture<T> future) {
        CompletableFuture<T> result = new CompletableFuture<>();
        future.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }
}
