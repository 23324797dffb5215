package com.ryuqq.recordgraph.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Store 고유 표현의 레코드 (평탄한 속성 맵).
 *
 * <p>StoredRecord는 레코드 종류(recordKind), 선택적 Identity, Store가 부여한
 * {@link SystemAttributes}, 그리고 이름 순서가 유지되는 {@link FieldValue} 맵으로 구성됩니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 변경 메서드({@code withField}, {@code withIdentity} 등)는
 * 새 인스턴스를 반환합니다. 따라서 캐시와 파이프라인 간에 안전하게 공유할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StoredRecord record = StoredRecord.builder("Person")
 *     .field("name", PrimitiveValue.of("Ada"))
 *     .field("team", ReferenceValue.to(teamId))
 *     .build();
 *
 * StoredRecord patched = record.withField("mentor", ReferenceValue.to(mentorId));
 * </pre>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class StoredRecord {

    private final String recordKind;
    private final Identity identity;
    private final SystemAttributes systemAttributes;
    private final Map<String, FieldValue> fields;

    private StoredRecord(String recordKind, Identity identity,
                         SystemAttributes systemAttributes, Map<String, FieldValue> fields) {
        if (recordKind == null || recordKind.isBlank()) {
            throw new IllegalArgumentException("recordKind cannot be null or blank");
        }
        if (systemAttributes == null) {
            throw new IllegalArgumentException("systemAttributes cannot be null");
        }
        for (String name : fields.keySet()) {
            if (SystemAttributes.isSystemField(name)) {
                throw new IllegalArgumentException("field name is reserved for system attributes: " + name);
            }
        }
        this.recordKind = recordKind;
        this.identity = identity;
        this.systemAttributes = systemAttributes;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * 빌더 생성.
     *
     * @param recordKind 레코드 종류 (타입 이름)
     * @return Builder
     */
    public static Builder builder(String recordKind) {
        return new Builder(recordKind);
    }

    public String getRecordKind() {
        return recordKind;
    }

    /**
     * Identity 조회.
     *
     * @return Identity (아직 저장 전이면 empty)
     */
    public Optional<Identity> getIdentity() {
        return Optional.ofNullable(identity);
    }

    public SystemAttributes getSystemAttributes() {
        return systemAttributes;
    }

    /**
     * 모든 필드 조회 (읽기 전용, 삽입 순서 유지).
     *
     * @return 필드 이름 → 값 맵
     */
    public Map<String, FieldValue> getFields() {
        return fields;
    }

    public Optional<FieldValue> getField(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /**
     * 이 레코드가 직접 참조하는 모든 Identity 조회.
     *
     * <p>단일 참조와 참조 리스트를 모두 포함하며, 필드 순서대로 반환합니다.</p>
     *
     * @return 참조 대상 Identity 목록
     */
    public List<Identity> referencedIdentities() {
        List<Identity> result = new ArrayList<>();
        for (FieldValue value : fields.values()) {
            if (value instanceof ReferenceValue reference) {
                result.add(reference.identity());
            } else if (value instanceof ReferenceList references) {
                result.addAll(references.identities());
            }
        }
        return result;
    }

    public StoredRecord withField(String name, FieldValue value) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        Map<String, FieldValue> copy = new LinkedHashMap<>(fields);
        copy.put(name, value);
        return new StoredRecord(recordKind, identity, systemAttributes, copy);
    }

    public StoredRecord withoutField(String name) {
        Map<String, FieldValue> copy = new LinkedHashMap<>(fields);
        copy.remove(name);
        return new StoredRecord(recordKind, identity, systemAttributes, copy);
    }

    public StoredRecord withIdentity(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        return new StoredRecord(recordKind, identity, systemAttributes, fields);
    }

    public StoredRecord withSystemAttributes(SystemAttributes systemAttributes) {
        return new StoredRecord(recordKind, identity, systemAttributes, fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoredRecord that = (StoredRecord) o;
        return recordKind.equals(that.recordKind)
                && Objects.equals(identity, that.identity)
                && systemAttributes.equals(that.systemAttributes)
                && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordKind, identity, systemAttributes, fields);
    }

    @Override
    public String toString() {
        return "StoredRecord{kind=" + recordKind
                + ", identity=" + (identity == null ? "unsaved" : identity.getValue())
                + ", fields=" + fields.keySet() + '}';
    }

    /**
     * StoredRecord 빌더.
     */
    public static final class Builder {

        private final String recordKind;
        private Identity identity;
        private SystemAttributes systemAttributes = SystemAttributes.none();
        private final Map<String, FieldValue> fields = new LinkedHashMap<>();

        private Builder(String recordKind) {
            this.recordKind = recordKind;
        }

        public Builder identity(Identity identity) {
            this.identity = identity;
            return this;
        }

        public Builder systemAttributes(SystemAttributes systemAttributes) {
            this.systemAttributes = systemAttributes;
            return this;
        }

        public Builder field(String name, FieldValue value) {
            if (name == null) {
                throw new IllegalArgumentException("name cannot be null");
            }
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
            fields.put(name, value);
            return this;
        }

        public StoredRecord build() {
            return new StoredRecord(recordKind, identity, systemAttributes, fields);
        }
    }
}
