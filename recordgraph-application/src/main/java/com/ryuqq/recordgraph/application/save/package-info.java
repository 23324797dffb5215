/**
 * 객체 그래프 저장.
 *
 * <p>{@link com.ryuqq.recordgraph.application.save.SavePipeline}이 객체를 레코드로 준비하고
 * ({@link com.ryuqq.recordgraph.application.save.PreparedRecord}), 순환 때문에 지금 쓸 수 없는
 * 참조는 {@link com.ryuqq.recordgraph.application.save.PendingReference}로 미뤄 두었다가
 * 양쪽 Identity가 생긴 뒤 채웁니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.application.save;
