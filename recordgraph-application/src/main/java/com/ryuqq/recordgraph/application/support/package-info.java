/**
 * 파이프라인 공통 보조 코드 (future 처리, 실패 로깅).
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.application.support;
