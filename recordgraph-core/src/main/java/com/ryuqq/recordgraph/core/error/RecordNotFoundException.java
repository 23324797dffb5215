package com.ryuqq.recordgraph.core.error;

import com.ryuqq.recordgraph.core.model.Identity;

/**
 * Store에 해당 Identity의 레코드가 없음.
 *
 * <p>{@code Store.fetch}가 이 예외로 완료되면 "존재하지 않음"으로 취급됩니다 (upsert 판별 등).</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class RecordNotFoundException extends PersistenceException {

    private final Identity identity;

    public RecordNotFoundException(Identity identity, String typeName) {
        super("Record not found with identity '" + (identity == null ? "unknown" : identity.getValue())
                + "' for type '" + (typeName == null ? "unknown" : typeName) + "'", null, typeName, null);
        this.identity = identity;
    }

    public Identity getIdentity() {
        return identity;
    }
}
