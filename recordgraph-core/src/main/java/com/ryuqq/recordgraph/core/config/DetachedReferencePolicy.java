package com.ryuqq.recordgraph.core.config;

/**
 * 부모에 Identity가 없고, 참조 대상이 캐시에 없으며, 대상에서 부모로 돌아오는 경로도 없는
 * 단일 참조의 처리 방식.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public enum DetachedReferencePolicy {

    /**
     * 참조를 기록하지 않고 WARN 로그만 남김.
     */
    SKIP,

    /**
     * 부모를 먼저 저장한 뒤 대상을 저장하고 참조를 채워 다시 저장 (기본값).
     */
    DEFER,

    /**
     * 대상을 먼저 저장하고 그 Identity를 참조로 기록.
     */
    SAVE_FIRST
}
