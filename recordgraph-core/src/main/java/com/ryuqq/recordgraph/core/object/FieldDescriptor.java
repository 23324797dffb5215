package com.ryuqq.recordgraph.core.object;

import java.time.Instant;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * 도메인 타입의 필드 하나에 대한 기술자.
 *
 * <p>리플렉션 대신 필드 이름, 분류, 값 타입, 접근자(getter)와 변경자(setter)를 명시적으로
 * 등록합니다. 리스트 필드의 {@code valueType}은 원소 타입입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FieldDescriptor.primitive("age", Integer.class, Person::getAge, Person::setAge);
 * FieldDescriptor.reference("team", Team.class, Person::getTeam, Person::setTeam);
 * </pre>
 *
 * @param <T> 소유 타입
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class FieldDescriptor<T> {

    private final String name;
    private final FieldKind kind;
    private final Class<?> valueType;
    private final Function<T, Object> getter;
    private final BiConsumer<T, Object> setter;

    private FieldDescriptor(String name, FieldKind kind, Class<?> valueType,
                            Function<T, Object> getter, BiConsumer<T, Object> setter) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (valueType == null) {
            throw new IllegalArgumentException("valueType cannot be null");
        }
        if (getter == null) {
            throw new IllegalArgumentException("getter cannot be null");
        }
        if (setter == null) {
            throw new IllegalArgumentException("setter cannot be null");
        }
        this.name = name;
        this.kind = kind;
        this.valueType = valueType;
        this.getter = getter;
        this.setter = setter;
    }

    /**
     * 원시 필드 (Number 계열, String, Boolean, Instant, enum).
     */
    public static <T, V> FieldDescriptor<T> primitive(String name, Class<V> type,
                                                      Function<T, V> getter, BiConsumer<T, V> setter) {
        if (!isPrimitiveType(type)) {
            throw new IllegalArgumentException("type is not a primitive type: " + type);
        }
        return new FieldDescriptor<>(name, FieldKind.PRIMITIVE, type, erase(getter), eraseSetter(setter));
    }

    public static <T, V> FieldDescriptor<T> primitiveList(String name, Class<V> elementType,
                                                          Function<T, List<V>> getter,
                                                          BiConsumer<T, List<V>> setter) {
        if (!isPrimitiveType(elementType)) {
            throw new IllegalArgumentException("elementType is not a primitive type: " + elementType);
        }
        return new FieldDescriptor<>(name, FieldKind.PRIMITIVE_LIST, elementType, erase(getter), eraseSetter(setter));
    }

    public static <T> FieldDescriptor<T> asset(String name, Function<T, byte[]> getter, BiConsumer<T, byte[]> setter) {
        return new FieldDescriptor<>(name, FieldKind.ASSET, byte[].class, erase(getter), eraseSetter(setter));
    }

    public static <T> FieldDescriptor<T> assetList(String name, Function<T, List<byte[]>> getter,
                                                   BiConsumer<T, List<byte[]>> setter) {
        return new FieldDescriptor<>(name, FieldKind.ASSET_LIST, byte[].class, erase(getter), eraseSetter(setter));
    }

    /**
     * 다른 Persistable 객체에 대한 단일 참조.
     */
    public static <T, R extends Persistable> FieldDescriptor<T> reference(String name, Class<R> target,
                                                                         Function<T, R> getter,
                                                                         BiConsumer<T, R> setter) {
        return new FieldDescriptor<>(name, FieldKind.REFERENCE, target, erase(getter), eraseSetter(setter));
    }

    public static <T, R extends Persistable> FieldDescriptor<T> referenceList(String name, Class<R> target,
                                                                             Function<T, List<R>> getter,
                                                                             BiConsumer<T, List<R>> setter) {
        return new FieldDescriptor<>(name, FieldKind.REFERENCE_LIST, target, erase(getter), eraseSetter(setter));
    }

    public String getName() {
        return name;
    }

    public FieldKind getKind() {
        return kind;
    }

    /**
     * 값 타입 (리스트 필드는 원소 타입, 참조 필드는 대상 타입).
     */
    public Class<?> getValueType() {
        return valueType;
    }

    public Object read(T owner) {
        return getter.apply(owner);
    }

    public void write(T owner, Object value) {
        setter.accept(owner, value);
    }

    @Override
    public String toString() {
        return "FieldDescriptor{" + name + ":" + kind + "<" + valueType.getSimpleName() + ">}";
    }

    static boolean isPrimitiveType(Class<?> type) {
        return type != null
                && (Number.class.isAssignableFrom(type)
                || type == String.class
                || type == Boolean.class
                || type == Instant.class
                || type.isEnum());
    }

    @SuppressWarnings("unchecked")
    private static <T> Function<T, Object> erase(Function<T, ?> getter) {
        if (getter == null) {
            throw new IllegalArgumentException("getter cannot be null");
        }
        return (Function<T, Object>) getter;
    }

    @SuppressWarnings("unchecked")
    private static <T, V> BiConsumer<T, Object> eraseSetter(BiConsumer<T, V> setter) {
        if (setter == null) {
            throw new IllegalArgumentException("setter cannot be null");
        }
        return (owner, value) -> setter.accept(owner, (V) value);
    }
}
