/**
 * In-memory Store adapter implementation package.
 *
 * <p>{@link com.ryuqq.recordgraph.adapter.inmemory.store.InMemoryStore} is a thread-safe,
 * reference-checking implementation of {@link com.ryuqq.recordgraph.core.spi.Store} used by
 * contract tests and as the reference for real store adapters.</p>
 *
 * @see com.ryuqq.recordgraph.core.spi.Store
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.adapter.inmemory.store;
