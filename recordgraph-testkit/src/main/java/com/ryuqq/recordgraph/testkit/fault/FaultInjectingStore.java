package com.ryuqq.recordgraph.testkit.fault;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.query.QueryMatch;
import com.ryuqq.recordgraph.core.query.QueryRequest;
import com.ryuqq.recordgraph.core.query.QueryResult;
import com.ryuqq.recordgraph.core.spi.Store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Store} decorator that counts calls and injects failures.
 *
 * <p><strong>Injection points:</strong></p>
 * <ul>
 *   <li>{@link #failNextSave(Throwable)}: the next save fails without reaching the delegate (queued, FIFO)</li>
 *   <li>{@link #failFetch(Identity, Throwable)}: every fetch of the identity fails until {@link #reset()}</li>
 *   <li>{@link #failNextQuery(Throwable)}: the next query page fails as a whole</li>
 *   <li>{@link #failMatch(Identity, Throwable)}: a successful match of the identity is turned into a failed one</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * FaultInjectingStore store = new FaultInjectingStore(new InMemoryStore());
 * store.failNextSave(new IllegalStateException("disk full"));
 *
 * assertThatThrownBy(() -&gt; graph.save(person).join()) ...
 * assertThat(store.saveCount()).isEqualTo(1);
 * </pre>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class FaultInjectingStore implements Store {

    private final Store delegate;

    private final AtomicInteger saveCount = new AtomicInteger();
    private final AtomicInteger fetchCount = new AtomicInteger();
    private final AtomicInteger deleteCount = new AtomicInteger();
    private final AtomicInteger queryCount = new AtomicInteger();
    private final Map<Identity, AtomicInteger> fetchesByIdentity = new ConcurrentHashMap<>();

    private final Queue<Throwable> saveFailures = new ConcurrentLinkedQueue<>();
    private final Queue<Throwable> queryFailures = new ConcurrentLinkedQueue<>();
    private final Map<Identity, Throwable> fetchFailures = new ConcurrentHashMap<>();
    private final Map<Identity, Throwable> matchFailures = new ConcurrentHashMap<>();

    public FaultInjectingStore(Store delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public CompletableFuture<StoredRecord> save(StoredRecord record) {
        saveCount.incrementAndGet();
        Throwable failure = saveFailures.poll();
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return delegate.save(record);
    }

    @Override
    public CompletableFuture<StoredRecord> fetch(Identity identity) {
        fetchCount.incrementAndGet();
        fetchesByIdentity.computeIfAbsent(identity, key -> new AtomicInteger()).incrementAndGet();
        Throwable failure = fetchFailures.get(identity);
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return delegate.fetch(identity);
    }

    @Override
    public CompletableFuture<Void> delete(Identity identity) {
        deleteCount.incrementAndGet();
        return delegate.delete(identity);
    }

    @Override
    public CompletableFuture<QueryResult> query(QueryRequest request) {
        queryCount.incrementAndGet();
        Throwable failure = queryFailures.poll();
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return delegate.query(request).thenApply(this::injectMatchFailures);
    }

    private QueryResult injectMatchFailures(QueryResult result) {
        if (matchFailures.isEmpty()) {
            return result;
        }
        List<QueryMatch> matches = new ArrayList<>(result.matches().size());
        for (QueryMatch match : result.matches()) {
            Throwable failure = matchFailures.get(match.identity());
            matches.add(failure != null && match.isSuccess() ? QueryMatch.failure(match.identity(), failure) : match);
        }
        return new QueryResult(matches, result.cursorOrNull());
    }

    public void failNextSave(Throwable failure) {
        saveFailures.add(requireFailure(failure));
    }

    public void failFetch(Identity identity, Throwable failure) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        fetchFailures.put(identity, requireFailure(failure));
    }

    public void failNextQuery(Throwable failure) {
        queryFailures.add(requireFailure(failure));
    }

    public void failMatch(Identity identity, Throwable failure) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        matchFailures.put(identity, requireFailure(failure));
    }

    public int saveCount() {
        return saveCount.get();
    }

    public int fetchCount() {
        return fetchCount.get();
    }

    public int fetchCount(Identity identity) {
        AtomicInteger count = fetchesByIdentity.get(identity);
        return count == null ? 0 : count.get();
    }

    public int deleteCount() {
        return deleteCount.get();
    }

    public int queryCount() {
        return queryCount.get();
    }

    /**
     * Clears counters and every pending injection.
     */
    public void reset() {
        saveCount.set(0);
        fetchCount.set(0);
        deleteCount.set(0);
        queryCount.set(0);
        fetchesByIdentity.clear();
        saveFailures.clear();
        queryFailures.clear();
        fetchFailures.clear();
        matchFailures.clear();
    }

    public Store getDelegate() {
        return delegate;
    }

    private static Throwable requireFailure(Throwable failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return failure;
    }
}
