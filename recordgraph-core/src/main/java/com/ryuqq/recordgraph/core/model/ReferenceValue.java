package com.ryuqq.recordgraph.core.model;

/**
 * 다른 레코드에 대한 참조.
 *
 * <p>Store는 이미 존재하는 Identity에 대한 참조만 허용합니다.
 * 이 제약이 저장 순서를 결정합니다.</p>
 *
 * @param identity 참조 대상 레코드의 Identity
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record ReferenceValue(Identity identity) implements FieldValue {

    public ReferenceValue {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
    }

    public static ReferenceValue to(Identity identity) {
        return new ReferenceValue(identity);
    }
}
