/**
 * 저장 가능한 객체 계약과 타입 기술자.
 *
 * <p>리플렉션 대신 도메인 타입마다 {@link com.ryuqq.recordgraph.core.object.TypeDescriptor}를
 * 등록해 필드 이름, 분류, 접근자를 명시합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.core.object;
