/**
 * Store decorators for failure-path tests.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.testkit.fault;
