package com.ryuqq.recordgraph.core.query;

import com.ryuqq.recordgraph.core.model.FieldValue;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.PrimitiveList;
import com.ryuqq.recordgraph.core.model.PrimitiveValue;
import com.ryuqq.recordgraph.core.model.ReferenceList;
import com.ryuqq.recordgraph.core.model.ReferenceValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * 쿼리 조건.
 *
 * <p>Store 구현체는 이 조건을 자신의 쿼리 언어로 번역하거나,
 * In-Memory 구현처럼 레코드마다 {@link #test(StoredRecord)}를 평가할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * QueryPredicate byTeam = QueryPredicate.references("team", teamId)
 *     .and(QueryPredicate.fieldEquals("active", true));
 * </pre>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueryPredicate {

    /**
     * 레코드가 조건을 만족하는지 평가.
     *
     * @param record 평가할 레코드
     * @return 만족하면 true
     */
    boolean test(StoredRecord record);

    /**
     * 모든 레코드와 일치하는 조건.
     *
     * @return 항상 true인 조건
     */
    static QueryPredicate all() {
        return record -> true;
    }

    /**
     * 원시 필드 값이 같은 레코드 (리스트 필드는 원소 포함 여부).
     *
     * @param field 필드 이름
     * @param value 비교 값
     * @return 조건
     */
    static QueryPredicate fieldEquals(String field, Object value) {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        return record -> {
            Optional<FieldValue> fieldValue = record.getField(field);
            if (fieldValue.isEmpty()) {
                return value == null;
            }
            FieldValue actual = fieldValue.get();
            if (actual instanceof PrimitiveValue primitive) {
                return Objects.equals(primitive.value(), value);
            }
            if (actual instanceof PrimitiveList list) {
                return list.values().contains(value);
            }
            return false;
        };
    }

    /**
     * 주어진 Identity를 참조하는 레코드 (단일 참조 또는 참조 리스트).
     *
     * @param field 참조 필드 이름
     * @param identity 참조 대상
     * @return 조건
     */
    static QueryPredicate references(String field, Identity identity) {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        return record -> {
            FieldValue actual = record.getField(field).orElse(null);
            if (actual instanceof ReferenceValue reference) {
                return reference.identity().equals(identity);
            }
            if (actual instanceof ReferenceList references) {
                return references.identities().contains(identity);
            }
            return false;
        };
    }

    /**
     * 두 조건의 논리곱.
     *
     * @param other 다른 조건
     * @return 결합된 조건
     */
    default QueryPredicate and(QueryPredicate other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return record -> test(record) && other.test(record);
    }
}
