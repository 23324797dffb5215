/**
 * 영속화 포트 ({@link com.ryuqq.recordgraph.application.graph.RecordGraph}).
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.application.graph;
