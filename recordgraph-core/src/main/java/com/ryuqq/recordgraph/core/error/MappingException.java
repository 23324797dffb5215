package com.ryuqq.recordgraph.core.error;

/**
 * 레코드를 객체로 변환하지 못함 (구조 불일치).
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class MappingException extends PersistenceException {

    public MappingException(String fieldName, String typeName, String message) {
        this(fieldName, typeName, message, null);
    }

    public MappingException(String fieldName, String typeName, String message, Throwable cause) {
        super("Could not map record to '" + typeName + "'"
                        + (fieldName == null ? "" : " at field '" + fieldName + "'") + ": " + message,
                fieldName, typeName, cause);
    }
}
