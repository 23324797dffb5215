package com.ryuqq.recordgraph.core.model;

import java.util.List;

/**
 * 참조 리스트.
 *
 * @param identities 참조 대상 Identity 목록 (불변 복사본, 순서 유지)
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record ReferenceList(List<Identity> identities) implements FieldValue {

    public ReferenceList {
        if (identities == null) {
            throw new IllegalArgumentException("identities cannot be null");
        }
        identities = List.copyOf(identities);
    }

    public static ReferenceList of(List<Identity> identities) {
        return new ReferenceList(identities);
    }
}
