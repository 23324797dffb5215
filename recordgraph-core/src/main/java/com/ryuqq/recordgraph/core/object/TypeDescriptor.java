package com.ryuqq.recordgraph.core.object;

import com.ryuqq.recordgraph.core.model.SystemAttributes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 도메인 타입 기술자.
 *
 * <p>레코드 종류(recordKind), 빈 인스턴스 팩토리, 필드 기술자 목록, 선택적
 * {@link CustomRecordCodec}으로 구성됩니다. recordKind를 지정하지 않으면 클래스의 단순 이름을
 * 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TypeDescriptor&lt;Person&gt; descriptor = TypeDescriptor.builder(Person.class, Person::new)
 *     .field(FieldDescriptor.primitive("name", String.class, Person::getName, Person::setName))
 *     .field(FieldDescriptor.reference("team", Team.class, Person::getTeam, Person::setTeam))
 *     .build();
 * </pre>
 *
 * @param <T> 도메인 타입
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class TypeDescriptor<T extends Persistable> {

    private final Class<T> type;
    private final String recordKind;
    private final Supplier<T> factory;
    private final List<FieldDescriptor<T>> fields;
    private final Map<String, FieldDescriptor<T>> fieldsByName;
    private final CustomRecordCodec<T> customCodec;

    private TypeDescriptor(Builder<T> builder) {
        this.type = builder.type;
        this.recordKind = builder.recordKind == null ? builder.type.getSimpleName() : builder.recordKind;
        this.factory = builder.factory;
        this.fields = Collections.unmodifiableList(new ArrayList<>(builder.fields.values()));
        this.fieldsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.customCodec = builder.customCodec;
    }

    public static <T extends Persistable> Builder<T> builder(Class<T> type, Supplier<T> factory) {
        return new Builder<>(type, factory);
    }

    public Class<T> getType() {
        return type;
    }

    public String getRecordKind() {
        return recordKind;
    }

    /**
     * 빈 인스턴스 생성.
     *
     * @return 새 인스턴스
     */
    public T newInstance() {
        T instance = factory.get();
        if (instance == null) {
            throw new IllegalStateException("factory returned null for type " + type.getName());
        }
        return instance;
    }

    public List<FieldDescriptor<T>> getFields() {
        return fields;
    }

    public Optional<FieldDescriptor<T>> getField(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    public Optional<CustomRecordCodec<T>> getCustomCodec() {
        return Optional.ofNullable(customCodec);
    }

    /**
     * Persistable 객체를 이 타입으로 캐스팅.
     *
     * @param object 객체
     * @return 캐스팅된 객체
     * @throws IllegalArgumentException 타입이 일치하지 않는 경우
     */
    public T cast(Persistable object) {
        if (!type.isInstance(object)) {
            throw new IllegalArgumentException(
                "object is not a " + type.getName() + ": " + (object == null ? "null" : object.getClass().getName())
            );
        }
        return type.cast(object);
    }

    @Override
    public String toString() {
        return "TypeDescriptor{" + recordKind + ", fields=" + fieldsByName.keySet() + '}';
    }

    /**
     * TypeDescriptor 빌더.
     *
     * @param <T> 도메인 타입
     */
    public static final class Builder<T extends Persistable> {

        private final Class<T> type;
        private final Supplier<T> factory;
        private final Map<String, FieldDescriptor<T>> fields = new LinkedHashMap<>();
        private String recordKind;
        private CustomRecordCodec<T> customCodec;

        private Builder(Class<T> type, Supplier<T> factory) {
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
            if (factory == null) {
                throw new IllegalArgumentException("factory cannot be null");
            }
            this.type = type;
            this.factory = factory;
        }

        public Builder<T> recordKind(String recordKind) {
            if (recordKind == null || recordKind.isBlank()) {
                throw new IllegalArgumentException("recordKind cannot be null or blank");
            }
            this.recordKind = recordKind;
            return this;
        }

        public Builder<T> field(FieldDescriptor<T> field) {
            if (field == null) {
                throw new IllegalArgumentException("field cannot be null");
            }
            if (fields.containsKey(field.getName())) {
                throw new IllegalArgumentException("duplicate field: " + field.getName());
            }
            if (SystemAttributes.isSystemField(field.getName())) {
                throw new IllegalArgumentException("field name is reserved for system attributes: " + field.getName());
            }
            fields.put(field.getName(), field);
            return this;
        }

        public Builder<T> customCodec(CustomRecordCodec<T> customCodec) {
            this.customCodec = customCodec;
            return this;
        }

        public TypeDescriptor<T> build() {
            return new TypeDescriptor<>(this);
        }
    }
}
