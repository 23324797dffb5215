package com.ryuqq.recordgraph.core.model;

import java.time.Instant;

/**
 * 원시 값 (숫자, 문자열, 불리언, 타임스탬프).
 *
 * @param value 원시 값 (Number, String, Boolean, Instant 중 하나)
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record PrimitiveValue(Object value) implements FieldValue {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null이거나 원시 타입이 아닌 경우
     */
    public PrimitiveValue {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (!isPrimitive(value)) {
            throw new IllegalArgumentException("value is not a primitive: " + value.getClass().getName());
        }
    }

    /**
     * PrimitiveValue 생성.
     *
     * @param value 원시 값
     * @return PrimitiveValue 인스턴스
     */
    public static PrimitiveValue of(Object value) {
        return new PrimitiveValue(value);
    }

    /**
     * 주어진 값이 레코드에 그대로 복사 가능한 원시 값인지 확인.
     *
     * @param value 검사할 값
     * @return Number, String, Boolean, Instant이면 true
     */
    public static boolean isPrimitive(Object value) {
        return value instanceof Number
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Instant;
    }
}
