package com.ryuqq.recordgraph.core.object;

import com.ryuqq.recordgraph.core.spi.FieldIntrospector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link TypeRegistry}에 등록된 기술자로 필드를 열거하는 기본 {@link FieldIntrospector}.
 *
 * <p>기술자에 {@link CustomRecordCodec}이 있으면 그 encode 결과를 선언 분류 없이 돌려줍니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class DescriptorFieldIntrospector implements FieldIntrospector {

    private final TypeRegistry registry;

    public DescriptorFieldIntrospector(TypeRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public String recordKindOf(Persistable object) {
        return registry.descriptorOf(object).getRecordKind();
    }

    @Override
    public List<FieldEntry> fieldsOf(Persistable object) {
        return entries(registry.descriptorOf(object), object);
    }

    private <T extends Persistable> List<FieldEntry> entries(TypeDescriptor<T> descriptor, Persistable object) {
        T typed = descriptor.cast(object);
        List<FieldEntry> result = new ArrayList<>();
        if (descriptor.getCustomCodec().isPresent()) {
            Map<String, Object> encoded = descriptor.getCustomCodec().get().encode(typed);
            for (Map.Entry<String, Object> entry : encoded.entrySet()) {
                result.add(new FieldEntry(entry.getKey(), entry.getValue(), null));
            }
            return result;
        }
        for (FieldDescriptor<T> field : descriptor.getFields()) {
            result.add(new FieldEntry(field.getName(), field.read(typed), field.getKind()));
        }
        return result;
    }
}
