package com.ryuqq.recordgraph.core.config;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.object.FieldEntry;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.spi.FieldIntrospector;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * 아직 Identity가 없는 객체를 처음 저장할 때의 Identity 결정 전략.
 *
 * <ul>
 *   <li>{@link StoreGenerated} - Store가 생성 (기본값)</li>
 *   <li>{@link ExternallySupplied} - 클라이언트가 UUID 생성</li>
 *   <li>{@link CustomGenerated} - 사용자 함수로 생성</li>
 *   <li>{@link FieldDerived} - 필드 값(점으로 구분된 경로)에서 유도</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public sealed interface IdentityStrategy {

    /**
     * 저장 전에 사용할 Identity 결정.
     *
     * @param object 저장할 객체
     * @param introspector 필드 열거기 (필드 유도 전략이 사용)
     * @return Identity (Store가 생성해야 하면 empty)
     * @throws IllegalStateException 필드 경로에서 값을 얻을 수 없는 경우
     */
    Optional<Identity> identityFor(Persistable object, FieldIntrospector introspector);

    static IdentityStrategy storeGenerated() {
        return new StoreGenerated();
    }

    static IdentityStrategy externallySupplied() {
        return new ExternallySupplied();
    }

    static IdentityStrategy custom(Function<Persistable, Identity> generator) {
        return new CustomGenerated(generator);
    }

    static IdentityStrategy fromField(String keyPath) {
        return new FieldDerived(keyPath);
    }

    record StoreGenerated() implements IdentityStrategy {
        @Override
        public Optional<Identity> identityFor(Persistable object, FieldIntrospector introspector) {
            return Optional.empty();
        }
    }

    record ExternallySupplied() implements IdentityStrategy {
        @Override
        public Optional<Identity> identityFor(Persistable object, FieldIntrospector introspector) {
            return Optional.of(Identity.of(UUID.randomUUID().toString()));
        }
    }

    record CustomGenerated(Function<Persistable, Identity> generator) implements IdentityStrategy {

        public CustomGenerated {
            if (generator == null) {
                throw new IllegalArgumentException("generator cannot be null");
            }
        }

        @Override
        public Optional<Identity> identityFor(Persistable object, FieldIntrospector introspector) {
            Identity identity = generator.apply(object);
            if (identity == null) {
                throw new IllegalStateException("identity generator returned null for " + object.getClass().getName());
            }
            return Optional.of(identity);
        }
    }

    /**
     * 필드 경로 유도 전략.
     *
     * <p>{@code "owner.email"}처럼 참조 필드를 따라갈 수 있습니다. 경로 끝의 값이 Persistable이면
     * 그 객체의 Identity를, 원시 값이면 문자열 표현을 사용합니다.</p>
     *
     * @param keyPath 점으로 구분된 필드 경로
     */
    record FieldDerived(String keyPath) implements IdentityStrategy {

        public FieldDerived {
            if (keyPath == null || keyPath.isBlank()) {
                throw new IllegalArgumentException("keyPath cannot be null or blank");
            }
        }

        @Override
        public Optional<Identity> identityFor(Persistable object, FieldIntrospector introspector) {
            Object current = object;
            for (String segment : keyPath.split("\\.")) {
                if (!(current instanceof Persistable persistable)) {
                    throw new IllegalStateException("key path '" + keyPath + "' cannot traverse " + describe(current));
                }
                current = valueOf(persistable, segment, introspector);
            }
            if (current instanceof Persistable persistable) {
                return Optional.of(persistable.getIdentity().orElseThrow(() ->
                    new IllegalStateException("key path '" + keyPath + "' ends at an unsaved object")));
            }
            if (current == null) {
                throw new IllegalStateException("key path '" + keyPath + "' resolved to null");
            }
            return Optional.of(Identity.of(current instanceof Enum<?> e ? e.name() : current.toString()));
        }

        private Object valueOf(Persistable owner, String field, FieldIntrospector introspector) {
            for (FieldEntry entry : introspector.fieldsOf(owner)) {
                if (entry.name().equals(field)) {
                    return entry.value();
                }
            }
            throw new IllegalStateException(
                "key path '" + keyPath + "' names unknown field '" + field + "' of " + owner.getClass().getSimpleName()
            );
        }

        private static String describe(Object value) {
            return value == null ? "null" : value.getClass().getSimpleName();
        }
    }
}
