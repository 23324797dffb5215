package com.ryuqq.recordgraph.core.model;

import java.time.Instant;

/**
 * Store가 부여하는 시스템 속성.
 *
 * <p>다섯 가지 속성 모두 Store가 할당하며, 호출자에게는 읽기 전용입니다.
 * 아직 저장되지 않은 레코드는 {@link #none()}을 가집니다.</p>
 *
 * @param createdBy 생성자 (null 가능)
 * @param createdAt 생성 시각 (null 가능)
 * @param modifiedBy 최종 수정자 (null 가능)
 * @param modifiedAt 최종 수정 시각 (null 가능)
 * @param changeTag 변경 태그 (null 가능)
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record SystemAttributes(
    String createdBy,
    Instant createdAt,
    String modifiedBy,
    Instant modifiedAt,
    String changeTag
) {

    public static final String IDENTITY = "identity";
    public static final String CREATED_BY = "createdBy";
    public static final String CREATED_AT = "createdAt";
    public static final String MODIFIED_BY = "modifiedBy";
    public static final String MODIFIED_AT = "modifiedAt";
    public static final String CHANGE_TAG = "changeTag";

    private static final SystemAttributes NONE = new SystemAttributes(null, null, null, null, null);

    /**
     * 아직 저장되지 않은 레코드의 시스템 속성.
     *
     * @return 모든 값이 null인 인스턴스
     */
    public static SystemAttributes none() {
        return NONE;
    }

    /**
     * 필드 이름이 시스템 속성(또는 identity)인지 확인.
     *
     * @param fieldName 필드 이름
     * @return 시스템 속성 이름이면 true
     */
    public static boolean isSystemField(String fieldName) {
        return IDENTITY.equals(fieldName)
                || CREATED_BY.equals(fieldName)
                || CREATED_AT.equals(fieldName)
                || MODIFIED_BY.equals(fieldName)
                || MODIFIED_AT.equals(fieldName)
                || CHANGE_TAG.equals(fieldName);
    }
}
