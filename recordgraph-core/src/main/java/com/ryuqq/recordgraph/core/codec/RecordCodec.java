package com.ryuqq.recordgraph.core.codec;

import com.ryuqq.recordgraph.core.error.MappingException;
import com.ryuqq.recordgraph.core.error.UnsupportedFieldTypeException;
import com.ryuqq.recordgraph.core.model.AssetList;
import com.ryuqq.recordgraph.core.model.AssetValue;
import com.ryuqq.recordgraph.core.model.FieldValue;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.PrimitiveList;
import com.ryuqq.recordgraph.core.model.PrimitiveValue;
import com.ryuqq.recordgraph.core.model.ReferenceList;
import com.ryuqq.recordgraph.core.model.ReferenceValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.model.SystemAttributes;
import com.ryuqq.recordgraph.core.object.CustomRecordCodec;
import com.ryuqq.recordgraph.core.object.FieldDescriptor;
import com.ryuqq.recordgraph.core.object.FieldEntry;
import com.ryuqq.recordgraph.core.object.FieldKind;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.object.TypeDescriptor;
import com.ryuqq.recordgraph.core.object.TypeRegistry;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 객체 ⇄ 레코드 변환기.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>classify: 필드 값의 런타임 분류 결정 (참조는 분류만 하고 해결하지 않음)</li>
 *   <li>encodeLeaf: 원시 값/자산 필드를 {@link FieldValue}로 변환</li>
 *   <li>toWireMap / sanitize: 레코드를 전송 형태의 맵으로 변환하고 정제</li>
 *   <li>decode: 기술자에 따라 맵에서 객체 그래프 복원</li>
 * </ul>
 *
 * <p><strong>정제(sanitize) 규칙:</strong></p>
 * <pre>
 * Instant  → epoch millis (Long)
 * byte[]   → base64 문자열
 * enum     → 이름
 * Map/List → 재귀 정제, Map의 null 값은 제거
 * </pre>
 *
 * <p>상태가 없으므로 Thread-safe합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class RecordCodec {

    private final TypeRegistry registry;

    public RecordCodec(TypeRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    public TypeRegistry getRegistry() {
        return registry;
    }

    /**
     * 필드 값의 런타임 분류 결정.
     *
     * <p>null 값은 건너뛰며(empty), 빈 리스트는 선언된 분류를 따릅니다.</p>
     *
     * @param typeName 소유 타입 이름
     * @param entry 필드 항목
     * @return 분류 (null 값이면 empty)
     * @throws UnsupportedFieldTypeException 지원하지 않는 값인 경우
     */
    public Optional<FieldKind> classify(String typeName, FieldEntry entry) {
        Object value = entry.value();
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof List<?> list) {
            return Optional.of(classifyList(typeName, entry, list));
        }
        if (value instanceof Persistable) {
            return Optional.of(FieldKind.REFERENCE);
        }
        if (value instanceof byte[]) {
            return Optional.of(FieldKind.ASSET);
        }
        if (isPrimitive(value)) {
            return Optional.of(FieldKind.PRIMITIVE);
        }
        throw new UnsupportedFieldTypeException(entry.name(), typeName, value.getClass().getName());
    }

    private FieldKind classifyList(String typeName, FieldEntry entry, List<?> list) {
        if (list.isEmpty()) {
            FieldKind declared = entry.declaredKindOrNull();
            return declared != null && declared.isList() ? declared : FieldKind.PRIMITIVE_LIST;
        }
        FieldKind result = null;
        for (Object element : list) {
            FieldKind elementKind;
            if (element instanceof Persistable) {
                elementKind = FieldKind.REFERENCE_LIST;
            } else if (element instanceof byte[]) {
                elementKind = FieldKind.ASSET_LIST;
            } else if (element != null && isPrimitive(element)) {
                elementKind = FieldKind.PRIMITIVE_LIST;
            } else {
                String kind = element == null ? "null" : element.getClass().getName();
                throw new UnsupportedFieldTypeException(entry.name(), typeName, "List<" + kind + ">");
            }
            if (result != null && result != elementKind) {
                throw new UnsupportedFieldTypeException(entry.name(), typeName, "List<mixed>");
            }
            result = elementKind;
        }
        return result;
    }

    /**
     * 원시 값/자산 필드를 레코드 값으로 변환.
     *
     * @throws IllegalArgumentException 참조 분류가 주어진 경우
     */
    public FieldValue encodeLeaf(FieldEntry entry, FieldKind kind) {
        Object value = entry.value();
        return switch (kind) {
            case PRIMITIVE -> PrimitiveValue.of(primitiveOf(value));
            case PRIMITIVE_LIST -> {
                List<Object> values = new ArrayList<>();
                for (Object element : (List<?>) value) {
                    values.add(primitiveOf(element));
                }
                yield PrimitiveList.of(values);
            }
            case ASSET -> AssetValue.of((byte[]) value);
            case ASSET_LIST -> {
                List<byte[]> contents = new ArrayList<>();
                for (Object element : (List<?>) value) {
                    contents.add((byte[]) element);
                }
                yield AssetList.ofBytes(contents);
            }
            case REFERENCE, REFERENCE_LIST ->
                throw new IllegalArgumentException("reference field '" + entry.name() + "' is not a leaf");
        };
    }

    /**
     * 레코드를 전송 형태의 맵으로 변환.
     *
     * <p>참조는 {@code {identity}} 맵으로 표현됩니다 (인라인하지 않음).</p>
     *
     * @param record 레코드
     * @return identity, 시스템 속성, 필드 순서의 맵
     */
    public Map<String, Object> toWireMap(StoredRecord record) {
        Map<String, Object> wire = new LinkedHashMap<>();
        record.getIdentity().ifPresent(identity -> wire.put(SystemAttributes.IDENTITY, identity.getValue()));
        SystemAttributes attributes = record.getSystemAttributes();
        putIfNotNull(wire, SystemAttributes.CREATED_BY, attributes.createdBy());
        putIfNotNull(wire, SystemAttributes.CREATED_AT, attributes.createdAt());
        putIfNotNull(wire, SystemAttributes.MODIFIED_BY, attributes.modifiedBy());
        putIfNotNull(wire, SystemAttributes.MODIFIED_AT, attributes.modifiedAt());
        putIfNotNull(wire, SystemAttributes.CHANGE_TAG, attributes.changeTag());
        for (Map.Entry<String, FieldValue> field : record.getFields().entrySet()) {
            wire.put(field.getKey(), wireValue(field.getValue()));
        }
        return wire;
    }

    private static Object wireValue(FieldValue value) {
        if (value instanceof PrimitiveValue primitive) {
            return primitive.value();
        }
        if (value instanceof AssetValue asset) {
            return asset.bytes();
        }
        if (value instanceof ReferenceValue reference) {
            return CycleMarker.reference(reference.identity());
        }
        if (value instanceof PrimitiveList list) {
            return new ArrayList<>(list.values());
        }
        if (value instanceof AssetList list) {
            List<Object> contents = new ArrayList<>();
            for (AssetValue asset : list.assets()) {
                contents.add(asset.bytes());
            }
            return contents;
        }
        ReferenceList references = (ReferenceList) value;
        List<Object> maps = new ArrayList<>();
        for (Identity identity : references.identities()) {
            maps.add(CycleMarker.reference(identity));
        }
        return maps;
    }

    /**
     * 맵 정제.
     *
     * @param values 원본 맵
     * @return 정제된 새 맵 (원본은 변경하지 않음)
     */
    public Map<String, Object> sanitize(Map<String, ?> values) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (entry.getValue() != null) {
                sanitized.put(entry.getKey(), sanitizeValue(entry.getValue()));
            }
        }
        return sanitized;
    }

    @SuppressWarnings("unchecked")
    private Object sanitizeValue(Object value) {
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Map<?, ?> map) {
            return sanitize((Map<String, ?>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> sanitized = new ArrayList<>(list.size());
            for (Object element : list) {
                sanitized.add(element == null ? null : sanitizeValue(element));
            }
            return sanitized;
        }
        return value;
    }

    /**
     * 정제된 맵에서 객체 복원.
     *
     * <p>같은 Identity는 같은 인스턴스로 복원되며, 순환 마커는 이미 만들어진 인스턴스
     * (없으면 Identity만 가진 stub)로 연결됩니다.</p>
     *
     * @param values 정제된 레코드 맵 (참조는 인라인된 맵)
     * @param descriptor 대상 타입 기술자
     * @param context 디코딩 컨텍스트
     * @return 복원된 객체
     * @throws MappingException 맵의 형태가 기술자와 맞지 않는 경우
     */
    public <T extends Persistable> T decode(Map<String, Object> values, TypeDescriptor<T> descriptor,
                                            DecodeContext context) {
        String typeName = descriptor.getRecordKind();
        Identity identity = identityOf(values, typeName);

        if (CycleMarker.isMarker(values)) {
            if (identity == null) {
                throw new MappingException(null, typeName, "cycle marker without identity");
            }
            return bind(identity, descriptor, context, typeName);
        }

        T instance;
        Optional<CustomRecordCodec<T>> customCodec = descriptor.getCustomCodec();
        if (customCodec.isPresent()) {
            instance = customCodec.get().decode(values, context);
            if (instance == null) {
                throw new MappingException(null, typeName, "custom codec returned null");
            }
            if (identity != null) {
                instance.assignIdentity(identity);
                context.register(identity, instance);
            }
        } else {
            instance = identity == null ? descriptor.newInstance() : bind(identity, descriptor, context, typeName);
            if (identity == null || context.markPopulated(identity)) {
                for (FieldDescriptor<T> field : descriptor.getFields()) {
                    decodeField(instance, field, values.get(field.getName()), typeName, context);
                }
            }
        }
        instance.applySystemAttributes(systemAttributesOf(values, typeName));
        return instance;
    }

    private <T extends Persistable> T bind(Identity identity, TypeDescriptor<T> descriptor,
                                           DecodeContext context, String typeName) {
        try {
            return context.instanceFor(identity, descriptor);
        } catch (IllegalStateException e) {
            throw new MappingException(null, typeName, e.getMessage(), e);
        }
    }

    private <T extends Persistable> void decodeField(T owner, FieldDescriptor<T> field, Object raw,
                                                     String typeName, DecodeContext context) {
        if (raw == null) {
            return;
        }
        String name = field.getName();
        Object decoded;
        try {
            decoded = switch (field.getKind()) {
                case PRIMITIVE -> coerce(raw, field.getValueType(), name, typeName);
                case PRIMITIVE_LIST -> {
                    List<Object> values = new ArrayList<>();
                    for (Object element : requireList(raw, name, typeName)) {
                        values.add(coerce(element, field.getValueType(), name, typeName));
                    }
                    yield values;
                }
                case ASSET -> bytesOf(raw, name, typeName);
                case ASSET_LIST -> {
                    List<byte[]> values = new ArrayList<>();
                    for (Object element : requireList(raw, name, typeName)) {
                        values.add(bytesOf(element, name, typeName));
                    }
                    yield values;
                }
                case REFERENCE -> decodeReference(raw, field.getValueType(), name, typeName, context);
                case REFERENCE_LIST -> {
                    List<Object> values = new ArrayList<>();
                    for (Object element : requireList(raw, name, typeName)) {
                        if (element != null) {
                            values.add(decodeReference(element, field.getValueType(), name, typeName, context));
                        }
                    }
                    yield values;
                }
            };
        } catch (IllegalArgumentException e) {
            throw new MappingException(name, typeName, e.getMessage(), e);
        }
        try {
            field.write(owner, decoded);
        } catch (ClassCastException e) {
            throw new MappingException(name, typeName, "setter rejected " + decoded.getClass().getSimpleName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private Persistable decodeReference(Object raw, Class<?> targetType, String field, String typeName,
                                        DecodeContext context) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new MappingException(field, typeName, "expected reference map but was " + raw.getClass().getSimpleName());
        }
        TypeDescriptor<? extends Persistable> target =
                registry.descriptorFor((Class<? extends Persistable>) targetType);
        return decode((Map<String, Object>) map, target, context);
    }

    private static List<?> requireList(Object raw, String field, String typeName) {
        if (raw instanceof List<?> list) {
            return list;
        }
        throw new MappingException(field, typeName, "expected list but was " + raw.getClass().getSimpleName());
    }

    private static byte[] bytesOf(Object raw, String field, String typeName) {
        if (raw instanceof byte[] bytes) {
            return bytes;
        }
        if (raw instanceof String text) {
            return Base64.getDecoder().decode(text);
        }
        throw new MappingException(field, typeName, "expected base64 text but was " + raw.getClass().getSimpleName());
    }

    /**
     * 저장 값을 선언 타입으로 변환 (숫자 확장/축소, epoch millis → Instant, 이름 → enum).
     *
     * <p>정수 타입으로 줄일 때 소수부는 버리며, 대상 타입의 범위를 벗어나면 MappingException입니다.</p>
     */
    static Object coerce(Object raw, Class<?> type, String field, String typeName) {
        if (type.isInstance(raw)) {
            return raw;
        }
        if (raw instanceof Number number) {
            try {
                if (type == Integer.class) return (int) integral(number, Integer.MIN_VALUE, Integer.MAX_VALUE);
                if (type == Long.class) return integral(number, Long.MIN_VALUE, Long.MAX_VALUE);
                if (type == Short.class) return (short) integral(number, Short.MIN_VALUE, Short.MAX_VALUE);
                if (type == Byte.class) return (byte) integral(number, Byte.MIN_VALUE, Byte.MAX_VALUE);
                if (type == Float.class) return floatOf(number);
            } catch (ArithmeticException e) {
                throw new MappingException(field, typeName,
                        "value " + number + " does not fit " + type.getSimpleName(), e);
            }
            if (type == Double.class) return number.doubleValue();
            if (type == BigDecimal.class) return new BigDecimal(number.toString());
            if (type == BigInteger.class) return new BigDecimal(number.toString()).toBigInteger();
            if (type == Number.class) return number;
            if (type == Instant.class) return Instant.ofEpochMilli(number.longValue());
        }
        if (raw instanceof String text) {
            if (type.isEnum()) {
                return enumConstant(type, text, field, typeName);
            }
            if (type == Instant.class) {
                try {
                    return Instant.parse(text);
                } catch (DateTimeParseException e) {
                    throw new MappingException(field, typeName, "unparseable instant '" + text + "'", e);
                }
            }
        }
        throw new MappingException(field, typeName,
                "expected " + type.getSimpleName() + " but was " + raw.getClass().getSimpleName());
    }

    private static long integral(Number number, long min, long max) {
        BigInteger whole;
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new ArithmeticException(number + " is not finite");
            }
            whole = BigDecimal.valueOf(value).toBigInteger();
        } else if (number instanceof BigDecimal decimal) {
            whole = decimal.toBigInteger();
        } else if (number instanceof BigInteger big) {
            whole = big;
        } else {
            whole = BigInteger.valueOf(number.longValue());
        }
        if (whole.compareTo(BigInteger.valueOf(min)) < 0 || whole.compareTo(BigInteger.valueOf(max)) > 0) {
            throw new ArithmeticException(number + " is out of range");
        }
        return whole.longValue();
    }

    private static float floatOf(Number number) {
        double value = number.doubleValue();
        if (!Double.isInfinite(value) && Math.abs(value) > Float.MAX_VALUE) {
            throw new ArithmeticException(number + " is out of range");
        }
        return (float) value;
    }

    private static Object enumConstant(Class<?> type, String name, String field, String typeName) {
        for (Object constant : type.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(name)) {
                return constant;
            }
        }
        throw new MappingException(field, typeName, "unknown " + type.getSimpleName() + " constant '" + name + "'");
    }

    private static Identity identityOf(Map<String, Object> values, String typeName) {
        Object raw = values.get(SystemAttributes.IDENTITY);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof String text)) {
            throw new MappingException(SystemAttributes.IDENTITY, typeName, "identity must be text");
        }
        try {
            return Identity.of(text);
        } catch (IllegalArgumentException e) {
            throw new MappingException(SystemAttributes.IDENTITY, typeName, e.getMessage(), e);
        }
    }

    private static SystemAttributes systemAttributesOf(Map<String, Object> values, String typeName) {
        return new SystemAttributes(
            textOf(values, SystemAttributes.CREATED_BY, typeName),
            instantOf(values, SystemAttributes.CREATED_AT, typeName),
            textOf(values, SystemAttributes.MODIFIED_BY, typeName),
            instantOf(values, SystemAttributes.MODIFIED_AT, typeName),
            textOf(values, SystemAttributes.CHANGE_TAG, typeName)
        );
    }

    private static String textOf(Map<String, Object> values, String key, String typeName) {
        Object raw = values.get(key);
        return raw == null ? null : (String) coerce(raw, String.class, key, typeName);
    }

    private static Instant instantOf(Map<String, Object> values, String key, String typeName) {
        Object raw = values.get(key);
        return raw == null ? null : (Instant) coerce(raw, Instant.class, key, typeName);
    }

    private static Object primitiveOf(Object value) {
        return value instanceof Enum<?> constant ? constant.name() : value;
    }

    private static boolean isPrimitive(Object value) {
        return PrimitiveValue.isPrimitive(value) || value instanceof Enum<?>;
    }

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
