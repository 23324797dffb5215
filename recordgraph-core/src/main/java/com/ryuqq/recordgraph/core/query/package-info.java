/**
 * 쿼리 모델 - 조건, 정렬, 커서 기반 페이지네이션.
 *
 * <p>{@link com.ryuqq.recordgraph.core.query.QueryRequest}로 한 페이지를 요청하고,
 * {@link com.ryuqq.recordgraph.core.query.QueryResult}의 cursor를 따라 다음 페이지를 가져옵니다.
 * 마지막 페이지의 cursor는 비어 있습니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.core.query;
