package com.ryuqq.recordgraph.core.error;

/**
 * update/delete 시 Identity가 없는 객체.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class RecordDoesNotExistException extends PersistenceException {

    public RecordDoesNotExistException(String typeName) {
        super("Record of type '" + typeName + "' does not exist yet: it has no identity", null, typeName, null);
    }
}
