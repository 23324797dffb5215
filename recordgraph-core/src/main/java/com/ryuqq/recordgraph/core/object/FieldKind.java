package com.ryuqq.recordgraph.core.object;

/**
 * 필드 값의 분류.
 *
 * <p>원시 값과 자산은 레코드에 그대로 복사되고, 참조는 저장 파이프라인이
 * 대상 객체를 먼저 저장(또는 지연)한 뒤 Identity로 기록합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public enum FieldKind {

    /** Number, String, Boolean, Instant, enum. */
    PRIMITIVE(false, false),

    PRIMITIVE_LIST(true, false),

    /** 바이트 배열 (Store의 자산 핸들). */
    ASSET(false, false),

    ASSET_LIST(true, false),

    /** 다른 {@link Persistable} 객체. */
    REFERENCE(false, true),

    REFERENCE_LIST(true, true);

    private final boolean list;
    private final boolean reference;

    FieldKind(boolean list, boolean reference) {
        this.list = list;
        this.reference = reference;
    }

    public boolean isList() {
        return list;
    }

    public boolean isReference() {
        return reference;
    }
}
