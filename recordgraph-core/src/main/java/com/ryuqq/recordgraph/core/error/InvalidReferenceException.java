package com.ryuqq.recordgraph.core.error;

/**
 * 참조 대상 저장은 성공했지만 Identity를 얻지 못한 경우.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class InvalidReferenceException extends PersistenceException {

    public InvalidReferenceException(String fieldName, String typeName) {
        super("Invalid reference in field '" + fieldName + "' of type '" + typeName + "'",
                fieldName, typeName, null);
    }
}
