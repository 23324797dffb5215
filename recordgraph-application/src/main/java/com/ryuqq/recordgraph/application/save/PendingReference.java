package com.ryuqq.recordgraph.application.save;

import com.ryuqq.recordgraph.core.object.Persistable;

/**
 * 준비 단계에서 해결하지 못해 지연된 참조.
 *
 * <p>부모 레코드가 먼저 저장된 뒤, 대상 객체를 저장하고 이 필드를 채워 부모를 다시 저장합니다.
 * 진행 중인 저장 하나가 소유하며, 그 저장이 끝나면 버려집니다. 단일 참조 필드만 지연되며 참조
 * 리스트 원소는 지연하지 않습니다.</p>
 *
 * @param fieldName 참조 필드 이름
 * @param target 참조 대상 객체
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record PendingReference(String fieldName, Persistable target) {

    public PendingReference {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName cannot be null or blank");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }
}
