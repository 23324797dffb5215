/**
 * Fixture domain types with their {@link com.ryuqq.recordgraph.core.object.TypeDescriptor}s.
 *
 * <p>Shared by the engine tests of every module; {@link com.ryuqq.recordgraph.testkit.fixture.Fixtures#registry()}
 * registers all of them.</p>
 */
package com.ryuqq.recordgraph.testkit.fixture;
