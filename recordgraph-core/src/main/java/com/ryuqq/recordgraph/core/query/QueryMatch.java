package com.ryuqq.recordgraph.core.query;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;

/**
 * 쿼리 결과의 개별 일치 항목.
 *
 * <p>Store는 일치한 레코드마다 레코드 자체 또는 그 레코드를 읽지 못한 오류를 돌려줄 수 있습니다.
 * 둘 중 정확히 하나만 non-null입니다.</p>
 *
 * @param identity 일치한 레코드의 Identity
 * @param recordOrNull 레코드 (오류면 null)
 * @param errorOrNull 오류 (성공이면 null)
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record QueryMatch(Identity identity, StoredRecord recordOrNull, Throwable errorOrNull) {

    public QueryMatch {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if ((recordOrNull == null) == (errorOrNull == null)) {
            throw new IllegalArgumentException("exactly one of record or error must be present");
        }
    }

    public static QueryMatch success(StoredRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Identity identity = record.getIdentity()
                .orElseThrow(() -> new IllegalArgumentException("record must have an identity"));
        return new QueryMatch(identity, record, null);
    }

    public static QueryMatch failure(Identity identity, Throwable error) {
        return new QueryMatch(identity, null, error);
    }

    public boolean isSuccess() {
        return recordOrNull != null;
    }
}
