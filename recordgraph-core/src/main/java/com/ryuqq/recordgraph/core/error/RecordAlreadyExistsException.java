package com.ryuqq.recordgraph.core.error;

import com.ryuqq.recordgraph.core.model.Identity;

/**
 * insert 시 이미 Identity가 부여된 객체.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class RecordAlreadyExistsException extends PersistenceException {

    private final Identity identity;

    public RecordAlreadyExistsException(Identity identity, String typeName) {
        super("Record already exists with identity '" + (identity == null ? "unknown" : identity.getValue())
                + "' for type '" + typeName + "'", null, typeName, null);
        this.identity = identity;
    }

    public Identity getIdentity() {
        return identity;
    }
}
