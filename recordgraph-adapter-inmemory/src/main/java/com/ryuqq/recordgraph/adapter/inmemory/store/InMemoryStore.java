package com.ryuqq.recordgraph.adapter.inmemory.store;

import com.ryuqq.recordgraph.core.error.RecordNotFoundException;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.model.SystemAttributes;
import com.ryuqq.recordgraph.core.query.QueryCursor;
import com.ryuqq.recordgraph.core.query.QueryMatch;
import com.ryuqq.recordgraph.core.query.QueryRequest;
import com.ryuqq.recordgraph.core.query.QueryResult;
import com.ryuqq.recordgraph.core.query.SortKey;
import com.ryuqq.recordgraph.core.spi.Store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link Store} SPI for testing and reference purposes.
 *
 * <p>Records live in a {@link ConcurrentHashMap} keyed by identity. Every operation completes
 * its future before returning, so callers observe the asynchronous contract without a thread
 * hop.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>records:</strong> ConcurrentHashMap&lt;Identity, StoredRecord&gt; - stored records with system attributes</li>
 *   <li><strong>cursors:</strong> ConcurrentHashMap&lt;String, CursorState&gt; - remaining identities of paginated queries</li>
 * </ul>
 *
 * <p><strong>Store Semantics:</strong></p>
 * <ul>
 *   <li>save without identity creates the record at a random UUID identity</li>
 *   <li>save with an unknown identity creates the record at that identity</li>
 *   <li>save of a record referencing a missing identity fails with IllegalStateException</li>
 *   <li>each save assigns modifiedBy/modifiedAt and a fresh changeTag; createdBy/createdAt are kept on replace</li>
 *   <li>fetch and delete of a missing identity fail with RecordNotFoundException</li>
 * </ul>
 *
 * <p><strong>Pagination:</strong> the first page of a query snapshots the identities that did not fit
 * into the page under a random cursor token. A continuation reads the snapshot in order; an identity
 * deleted in the meantime is reported as a failed {@link QueryMatch}. Each cursor can be used once.
 * A cursor expires {@link #CURSOR_TTL} after it was issued. Expired cursors are dropped whenever a
 * new one is issued, and at most {@link #MAX_OPEN_CURSORS} stay open (the oldest goes first).</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Reference check and write are not atomic against a concurrent delete</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Store store = new InMemoryStore();
 * StoredRecord saved = store.save(StoredRecord.builder("Person")
 *     .field("name", PrimitiveValue.of("Ada"))
 *     .build()).join();
 *
 * StoredRecord fetched = store.fetch(saved.getIdentity().orElseThrow()).join();
 * </pre>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class InMemoryStore implements Store {

    /**
     * Author recorded in createdBy/modifiedBy when none is configured.
     */
    public static final String DEFAULT_USER = "in-memory";

    /**
     * How long an unused cursor stays valid.
     */
    public static final Duration CURSOR_TTL = Duration.ofMinutes(10);

    /**
     * Upper bound of cursors kept open at once.
     */
    public static final int MAX_OPEN_CURSORS = 1000;

    private final ConcurrentHashMap<Identity, StoredRecord> records;
    private final ConcurrentHashMap<String, CursorState> cursors;
    private final Clock clock;
    private final String user;

    /**
     * Creates a new InMemoryStore with empty storage, the system clock and {@link #DEFAULT_USER}.
     */
    public InMemoryStore() {
        this(Clock.systemUTC(), DEFAULT_USER);
    }

    /**
     * Creates a new InMemoryStore.
     *
     * @param clock clock used for createdAt/modifiedAt
     * @param user author recorded in createdBy/modifiedBy
     * @throws IllegalArgumentException if clock or user is null
     */
    public InMemoryStore(Clock clock, String user) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (user == null) {
            throw new IllegalArgumentException("user cannot be null");
        }
        this.records = new ConcurrentHashMap<>();
        this.cursors = new ConcurrentHashMap<>();
        this.clock = clock;
        this.user = user;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>A reference to the record's own identity counts as existing</li>
     *   <li>createdAt/createdBy survive a replace; everything else in SystemAttributes is reassigned</li>
     * </ul>
     */
    @Override
    public CompletableFuture<StoredRecord> save(StoredRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Identity identity = record.getIdentity().orElseGet(() -> Identity.of(UUID.randomUUID().toString()));

        for (Identity referenced : record.referencedIdentities()) {
            if (!referenced.equals(identity) && !records.containsKey(referenced)) {
                return CompletableFuture.failedFuture(new IllegalStateException(
                    "Record of kind '" + record.getRecordKind() + "' references missing identity '"
                        + referenced.getValue() + "'"));
            }
        }

        Instant now = clock.instant();
        String changeTag = UUID.randomUUID().toString();
        StoredRecord stored = records.compute(identity, (key, existing) -> {
            SystemAttributes previous = existing == null ? null : existing.getSystemAttributes();
            SystemAttributes attributes = new SystemAttributes(
                previous == null ? user : previous.createdBy(),
                previous == null ? now : previous.createdAt(),
                user,
                now,
                changeTag
            );
            return record.withIdentity(key).withSystemAttributes(attributes);
        });
        return CompletableFuture.completedFuture(stored);
    }

    @Override
    public CompletableFuture<StoredRecord> fetch(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        StoredRecord record = records.get(identity);
        if (record == null) {
            return CompletableFuture.failedFuture(new RecordNotFoundException(identity, null));
        }
        return CompletableFuture.completedFuture(record);
    }

    @Override
    public CompletableFuture<Void> delete(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (records.remove(identity) == null) {
            return CompletableFuture.failedFuture(new RecordNotFoundException(identity, null));
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>First page: filter by record kind and predicate, sort, cut at limit</li>
     *   <li>Continuation: the predicate and sort keys of the request are ignored</li>
     *   <li>An unknown or already consumed cursor fails the page with IllegalStateException</li>
     * </ul>
     */
    @Override
    public CompletableFuture<QueryResult> query(QueryRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        List<Identity> ordered;
        Optional<QueryCursor> cursor = request.cursor();
        if (cursor.isPresent()) {
            CursorState state = cursors.remove(cursor.get().getToken());
            if (state == null || !state.recordKind().equals(request.recordKind())
                    || isExpired(state, clock.instant())) {
                return CompletableFuture.failedFuture(new IllegalStateException(
                    "Unknown or expired cursor: " + cursor.get().getToken()));
            }
            ordered = state.remaining();
        } else {
            ordered = records.values().stream()
                .filter(record -> record.getRecordKind().equals(request.recordKind()))
                .filter(request.predicate()::test)
                .sorted(SortKey.comparator(request.sortKeys())
                    .thenComparing(record -> record.getIdentity().map(Identity::getValue).orElse("")))
                .map(record -> record.getIdentity().orElseThrow())
                .collect(Collectors.toList());
        }

        int pageSize = Math.min(request.limit(), ordered.size());
        List<QueryMatch> matches = new ArrayList<>(pageSize);
        for (Identity identity : ordered.subList(0, pageSize)) {
            StoredRecord record = records.get(identity);
            if (record == null) {
                matches.add(QueryMatch.failure(identity, new RecordNotFoundException(identity, request.recordKind())));
            } else {
                matches.add(QueryMatch.success(record));
            }
        }

        if (pageSize == ordered.size()) {
            return CompletableFuture.completedFuture(QueryResult.lastPage(matches));
        }
        Instant now = clock.instant();
        evictCursors(now);
        String token = UUID.randomUUID().toString();
        cursors.put(token, new CursorState(request.recordKind(),
            List.copyOf(ordered.subList(pageSize, ordered.size())), now));
        return CompletableFuture.completedFuture(new QueryResult(matches, QueryCursor.of(token)));
    }

    /**
     * Stores a record verbatim, bypassing reference checks and system attribute assignment.
     *
     * <p>For tests that need records the engine itself would never write.</p>
     *
     * @param record record with identity
     * @throws IllegalArgumentException if record is null or has no identity
     */
    public void putRaw(StoredRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Identity identity = record.getIdentity()
            .orElseThrow(() -> new IllegalArgumentException("record must have an identity"));
        records.put(identity, record);
    }

    public boolean contains(Identity identity) {
        return records.containsKey(identity);
    }

    public int size() {
        return records.size();
    }

    public int openCursorCount() {
        return cursors.size();
    }

    /**
     * Removes all records and open cursors.
     */
    public void clear() {
        records.clear();
        cursors.clear();
    }

    private void evictCursors(Instant now) {
        cursors.values().removeIf(state -> isExpired(state, now));
        while (cursors.size() >= MAX_OPEN_CURSORS) {
            Optional<Map.Entry<String, CursorState>> oldest = cursors.entrySet().stream()
                .min(Comparator.comparing((Map.Entry<String, CursorState> entry) -> entry.getValue().issuedAt()));
            if (oldest.isEmpty()) {
                break;
            }
            cursors.remove(oldest.get().getKey(), oldest.get().getValue());
        }
    }

    private static boolean isExpired(CursorState state, Instant now) {
        return !now.isBefore(state.issuedAt().plus(CURSOR_TTL));
    }

    private record CursorState(String recordKind, List<Identity> remaining, Instant issuedAt) {
    }
}
