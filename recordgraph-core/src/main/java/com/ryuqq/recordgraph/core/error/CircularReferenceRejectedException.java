package com.ryuqq.recordgraph.core.error;

/**
 * 순환 참조로 인해 거부된 작업.
 *
 * <p>조회 시 가져온 레코드의 참조 그래프에 순환이 있거나,
 * 저장 시 리스트 원소가 지연(deferral)을 필요로 하는 경우 발생합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class CircularReferenceRejectedException extends PersistenceException {

    public CircularReferenceRejectedException(String fieldName, String typeName) {
        super("Circular reference detected in field '" + (fieldName == null ? "unknown" : fieldName)
                + "' of type '" + typeName + "'", fieldName, typeName, null);
    }
}
