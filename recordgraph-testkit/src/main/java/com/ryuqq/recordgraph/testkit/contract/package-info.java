/**
 * Store SPI contract tests, extended by each adapter's test suite.
 *
 * @see com.ryuqq.recordgraph.testkit.contract.AbstractStoreContractTest
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.testkit.contract;
