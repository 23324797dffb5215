/**
 * RecordGraph 실행 구성요소.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.recordgraph.adapter.runner.PipelineRecordGraph}: 파이프라인을 조립한 RecordGraph 구현체</li>
 *   <li>{@link com.ryuqq.recordgraph.adapter.runner.BlockingRecordGraph}: 호출당 한 번 대기하는 동기 래퍼</li>
 *   <li>{@link com.ryuqq.recordgraph.adapter.runner.CacheSweeper}: 만료 캐시 항목 주기 정리</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.adapter.runner;
