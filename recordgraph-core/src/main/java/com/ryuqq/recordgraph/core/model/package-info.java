/**
 * RecordGraph Core 도메인 모델.
 *
 * <p>Store에 저장되는 레코드의 일반 표현과 그 구성 요소를 정의합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.recordgraph.core.model.Identity} - 레코드 식별자 (불변)</li>
 *   <li>{@link com.ryuqq.recordgraph.core.model.StoredRecord} - 평탄한 속성 맵 레코드</li>
 *   <li>{@link com.ryuqq.recordgraph.core.model.FieldValue} - 속성 값 (sealed)</li>
 *   <li>{@link com.ryuqq.recordgraph.core.model.SystemAttributes} - Store 부여 시스템 속성</li>
 * </ul>
 *
 * <h2>불변 조건</h2>
 * <ul>
 *   <li>레코드는 이미 존재하는 Identity만 참조할 수 있습니다 (Store가 강제).</li>
 *   <li>Identity는 한 번 부여되면 변경되지 않습니다.</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.core.model;
