package com.ryuqq.recordgraph.core.spi;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.query.QueryRequest;
import com.ryuqq.recordgraph.core.query.QueryResult;

import java.util.concurrent.CompletableFuture;

/**
 * Record Store SPI.
 *
 * <p>Abstraction over the backing record store. Every operation is asynchronous and
 * completes its future exceptionally on failure; implementations never block the caller.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Atomic per-record writes that assign identity and system attributes</li>
 *   <li>Single-record fetch and delete by identity</li>
 *   <li>Cursor-paginated queries by record kind, predicate and sort keys</li>
 * </ul>
 *
 * <p><strong>Referential Integrity:</strong></p>
 * <pre>
 * A record may only reference identities that already exist in the store.
 * save() of a record holding a dangling ReferenceValue/ReferenceList must fail.
 * </pre>
 *
 * <p><strong>Wire Shape:</strong></p>
 * <pre>
 * { identity, createdBy, createdAt, modifiedBy, modifiedAt, changeTag, ...fields }
 * references are { identity }, assets are base64 text once sanitized
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Non-blocking: return a future, do the work elsewhere (or complete immediately)</li>
 *   <li>Not found: fetch/delete of a missing identity fail with RecordNotFoundException</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public interface Store {

    /**
     * Creates or replaces a record.
     *
     * <p>A record without identity is created and receives one (store-generated). A record
     * with identity is created at that identity when absent, replaced otherwise. The returned
     * record carries the identity and the store-assigned system attributes.</p>
     *
     * @param record the record to write
     * @return future of the stored record
     * @throws IllegalArgumentException if record is null
     */
    CompletableFuture<StoredRecord> save(StoredRecord record);

    /**
     * Fetches a record by identity.
     *
     * @param identity the identity
     * @return future of the record, failing with RecordNotFoundException when absent
     * @throws IllegalArgumentException if identity is null
     */
    CompletableFuture<StoredRecord> fetch(Identity identity);

    /**
     * Deletes a record by identity.
     *
     * @param identity the identity
     * @return future completing when deleted, failing with RecordNotFoundException when absent
     * @throws IllegalArgumentException if identity is null
     */
    CompletableFuture<Void> delete(Identity identity);

    /**
     * Runs one page of a query.
     *
     * <p>When the request carries a cursor, the store continues the query that produced it.
     * The last page has no cursor. A failure affecting the page as a whole fails the future;
     * a failure reading an individual match is reported as a {@code QueryMatch} error.</p>
     *
     * @param request the query request
     * @return future of one result page
     * @throws IllegalArgumentException if request is null
     */
    CompletableFuture<QueryResult> query(QueryRequest request);
}
