package com.ryuqq.recordgraph.core.object;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 도메인 타입 기술자 저장소.
 *
 * <p>클래스와 레코드 종류(recordKind) 양쪽으로 조회할 수 있습니다.
 * 등록은 보통 애플리케이션 시작 시 한 번 하지만, Thread-safe하므로 이후 등록도 가능합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class TypeRegistry {

    private final Map<Class<?>, TypeDescriptor<?>> byType = new ConcurrentHashMap<>();
    private final Map<String, TypeDescriptor<?>> byKind = new ConcurrentHashMap<>();

    /**
     * 기술자 등록.
     *
     * @param descriptor 타입 기술자
     * @return this (연쇄 호출용)
     * @throws IllegalArgumentException 같은 recordKind가 다른 타입에 이미 등록된 경우
     */
    public TypeRegistry register(TypeDescriptor<?> descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        TypeDescriptor<?> existing = byKind.putIfAbsent(descriptor.getRecordKind(), descriptor);
        if (existing != null && existing.getType() != descriptor.getType()) {
            throw new IllegalArgumentException(
                "recordKind '" + descriptor.getRecordKind() + "' already registered for " + existing.getType().getName()
            );
        }
        byKind.put(descriptor.getRecordKind(), descriptor);
        byType.put(descriptor.getType(), descriptor);
        return this;
    }

    /**
     * 클래스로 기술자 조회.
     *
     * @throws IllegalArgumentException 등록되지 않은 타입인 경우
     */
    @SuppressWarnings("unchecked")
    public <T extends Persistable> TypeDescriptor<T> descriptorFor(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        TypeDescriptor<?> descriptor = byType.get(type);
        if (descriptor == null) {
            throw new IllegalArgumentException("no descriptor registered for " + type.getName());
        }
        return (TypeDescriptor<T>) descriptor;
    }

    /**
     * 객체의 런타임 클래스로 기술자 조회.
     */
    @SuppressWarnings("unchecked")
    public <T extends Persistable> TypeDescriptor<T> descriptorOf(T object) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }
        return (TypeDescriptor<T>) descriptorFor(object.getClass());
    }

    public Optional<TypeDescriptor<?>> findByRecordKind(String recordKind) {
        return Optional.ofNullable(byKind.get(recordKind));
    }

    public boolean isRegistered(Class<?> type) {
        return byType.containsKey(type);
    }
}
