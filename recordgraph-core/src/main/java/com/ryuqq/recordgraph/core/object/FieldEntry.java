package com.ryuqq.recordgraph.core.object;

/**
 * 객체에서 읽어낸 필드 하나.
 *
 * @param name 필드 이름
 * @param value 필드 값 (null 가능)
 * @param declaredKindOrNull 선언된 분류 (사용자 정의 codec이 만든 항목이면 null)
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record FieldEntry(String name, Object value, FieldKind declaredKindOrNull) {

    public FieldEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
