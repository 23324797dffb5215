package com.ryuqq.recordgraph.application.support;

import com.ryuqq.recordgraph.core.config.ErrorLogging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 실패 로깅 ({@link ErrorLogging} 상세도 적용).
 *
 * <ul>
 *   <li>NONE: 로깅하지 않음</li>
 *   <li>SUMMARY: WARN 한 줄 (예외 메시지)</li>
 *   <li>VERBOSE: ERROR + 스택 트레이스</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    private final ErrorLogging level;

    public ErrorReporter(ErrorLogging level) {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        this.level = level;
    }

    /**
     * 실패 보고.
     *
     * @param operation 연산 이름 (save, load, query 등)
     * @param typeName 대상 타입 이름
     * @param error 실패 원인
     */
    public void report(String operation, String typeName, Throwable error) {
        Throwable cause = Futures.unwrap(error);
        switch (level) {
            case NONE -> { }
            case SUMMARY -> log.warn("{} failed for {}: {}", operation, typeName, cause.getMessage());
            case VERBOSE -> log.error("{} failed for {}", operation, typeName, cause);
        }
    }

    public ErrorLogging getLevel() {
        return level;
    }
}
