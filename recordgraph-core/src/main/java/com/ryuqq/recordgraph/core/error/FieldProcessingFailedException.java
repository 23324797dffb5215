package com.ryuqq.recordgraph.core.error;

/**
 * 필드 처리 실패.
 *
 * <p>저장 준비 중 한 필드를 처리하다 발생한 모든 하위 오류를 감쌉니다.
 * 이 예외가 발생하면 해당 루트 객체와 그 의존 체인의 저장 전체가 중단됩니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class FieldProcessingFailedException extends PersistenceException {

    public FieldProcessingFailedException(String fieldName, String typeName, Throwable cause) {
        super("Failed to process field '" + fieldName + "' in type '" + typeName + "': " + describeCause(cause),
                fieldName, typeName, cause);
    }
}
