package com.ryuqq.recordgraph.adapter.runner;

import com.ryuqq.recordgraph.application.graph.RecordGraph;
import com.ryuqq.recordgraph.application.load.LoadPage;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.query.QueryCursor;
import com.ryuqq.recordgraph.core.query.QueryPredicate;
import com.ryuqq.recordgraph.core.query.SortKey;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link RecordGraph}의 동기 래퍼.
 *
 * <p>호출마다 future를 정확히 한 번 {@code get(timeout)}으로 기다립니다. 폴링하지 않습니다.</p>
 *
 * <p><strong>예외 변환:</strong></p>
 * <ul>
 *   <li>future 실패: 원인 예외를 그대로 던짐 (RuntimeException이 아니면 IllegalStateException으로 감쌈)</li>
 *   <li>시간 초과: IllegalStateException (원인 TimeoutException). 이미 시작된 Store 쓰기는 되돌리지 않음</li>
 *   <li>인터럽트: 인터럽트 플래그를 복원하고 IllegalStateException</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class BlockingRecordGraph {

    private final RecordGraph delegate;
    private final Duration timeout;

    /**
     * 생성자.
     *
     * @param delegate 비동기 RecordGraph
     * @param timeout 호출당 최대 대기 시간
     * @throws IllegalArgumentException delegate가 null이거나 timeout이 양수가 아닌 경우
     */
    public BlockingRecordGraph(RecordGraph delegate, Duration timeout) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.delegate = delegate;
        this.timeout = timeout;
    }

    public <T extends Persistable> T save(T object) {
        return await(delegate.save(object));
    }

    public <T extends Persistable> T insert(T object) {
        return await(delegate.insert(object));
    }

    public <T extends Persistable> T update(T object) {
        return await(delegate.update(object));
    }

    public <T extends Persistable> T upsert(T object) {
        return await(delegate.upsert(object));
    }

    public <T extends Persistable> T load(Class<T> type, Identity identity) {
        return await(delegate.load(type, identity));
    }

    public <T extends Persistable> T refresh(Class<T> type, Identity identity) {
        return await(delegate.refresh(type, identity));
    }

    public <T extends Persistable> LoadPage<T> loadAll(Class<T> type, QueryPredicate predicate,
                                                       List<SortKey> sortKeys, int limit) {
        return await(delegate.loadAll(type, predicate, sortKeys, limit));
    }

    public <T extends Persistable> LoadPage<T> loadNext(Class<T> type, QueryCursor cursor, int limit) {
        return await(delegate.loadNext(type, cursor, limit));
    }

    public <T extends Persistable> LoadPage<T> loadAllExhaustive(Class<T> type, QueryPredicate predicate,
                                                                 List<SortKey> sortKeys, int limit) {
        return await(delegate.loadAllExhaustive(type, predicate, sortKeys, limit));
    }

    public void delete(Persistable object) {
        await(delegate.delete(object));
    }

    public void deleteCascade(Persistable object) {
        await(delegate.deleteCascade(object));
    }

    public Duration getTimeout() {
        return timeout;
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("RecordGraph operation failed", cause);
        } catch (TimeoutException e) {
            throw new IllegalStateException("RecordGraph operation timed out after " + timeout.toMillis() + "ms", e);
        } catch (CancellationException e) {
            throw new IllegalStateException("RecordGraph operation was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for RecordGraph operation", e);
        }
    }
}
