/**
 * TTL 레코드 캐시.
 *
 * <p>{@link com.ryuqq.recordgraph.application.cache.RecordCache}는 전역 싱글톤이 아니라
 * 생성 가능한 서비스입니다. 시작 시 생성해 파이프라인에 전달하고, 종료 시 close합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.application.cache;
