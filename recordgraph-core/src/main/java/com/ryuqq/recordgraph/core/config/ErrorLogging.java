package com.ryuqq.recordgraph.core.config;

/**
 * 실패 로깅 상세도.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public enum ErrorLogging {

    /** 로깅하지 않음. */
    NONE,

    /** 한 줄 요약 (예외 메시지). */
    SUMMARY,

    /** 요약 + 스택 트레이스. */
    VERBOSE
}
