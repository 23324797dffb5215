package com.ryuqq.recordgraph.adapter.inmemory.store;

import com.ryuqq.recordgraph.core.spi.Store;
import com.ryuqq.recordgraph.testkit.contract.AbstractStoreContractTest;

/**
 * Contract Tests for InMemoryStore implementation.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
class InMemoryStoreContractTest extends AbstractStoreContractTest {

    @Override
    protected Store createStore() {
        return new InMemoryStore();
    }
}
