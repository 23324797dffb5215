package com.ryuqq.recordgraph.core.model;

/**
 * 레코드 속성 값.
 *
 * <p>StoredRecord의 각 속성은 다음 여섯 가지 중 하나입니다:</p>
 * <ul>
 *   <li>{@link PrimitiveValue}: 숫자, 문자열, 불리언, 타임스탬프</li>
 *   <li>{@link AssetValue}: 바이트 배열 (Store 자산 핸들)</li>
 *   <li>{@link ReferenceValue}: 다른 레코드의 Identity</li>
 *   <li>{@link PrimitiveList}, {@link AssetList}, {@link ReferenceList}: 위 값들의 리스트</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public sealed interface FieldValue
        permits PrimitiveValue, AssetValue, ReferenceValue, PrimitiveList, AssetList, ReferenceList {

    /**
     * 참조 값(단일 또는 리스트)인지 확인.
     *
     * @return 참조 값 여부
     */
    default boolean isReference() {
        return this instanceof ReferenceValue || this instanceof ReferenceList;
    }

    /**
     * 리스트 값인지 확인.
     *
     * @return 리스트 값 여부
     */
    default boolean isList() {
        return this instanceof PrimitiveList || this instanceof AssetList || this instanceof ReferenceList;
    }
}
