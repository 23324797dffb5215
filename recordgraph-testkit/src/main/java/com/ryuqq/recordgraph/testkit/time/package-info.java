/**
 * Test clocks.
 */
package com.ryuqq.recordgraph.testkit.time;
