package com.ryuqq.recordgraph.core.error;

/**
 * 참조 대상(의존 브랜치) 저장 실패.
 *
 * <p>리스트 필드의 경우 필드 이름에 인덱스가 포함됩니다 (예: {@code members[2]}).</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class ReferenceSavingFailedException extends PersistenceException {

    public ReferenceSavingFailedException(String fieldName, String typeName, Throwable cause) {
        super("Failed to save reference for field '" + fieldName + "' in type '" + typeName + "': " + describeCause(cause),
                fieldName, typeName, cause);
    }
}
