package com.ryuqq.recordgraph.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 원시 값 리스트.
 *
 * @param values 원시 값 목록 (불변 복사본)
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record PrimitiveList(List<Object> values) implements FieldValue {

    public PrimitiveList {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        for (Object value : values) {
            if (!PrimitiveValue.isPrimitive(value)) {
                throw new IllegalArgumentException("list element is not a primitive: " + value);
            }
        }
        values = List.copyOf(values);
    }

    public static PrimitiveList of(List<?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        return new PrimitiveList(new ArrayList<Object>(values));
    }
}
