package com.ryuqq.recordgraph.core.object;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.SystemAttributes;

import java.util.Optional;

/**
 * {@link Persistable}의 기본 구현.
 *
 * <p>Identity와 시스템 속성 보관만 담당합니다. 하위 클래스는 도메인 필드와
 * {@link TypeDescriptor}만 제공하면 됩니다.</p>
 *
 * <p><strong>주의:</strong> equals/hashCode를 재정의하지 않습니다. 객체 그래프 순회는
 * 객체 동일성(identity)으로 비교하기 때문입니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public abstract class AbstractPersistable implements Persistable {

    // 동시 저장이 같은 객체에 Identity를 반영할 수 있음
    private volatile Identity identity;
    private volatile SystemAttributes systemAttributes = SystemAttributes.none();

    @Override
    public Optional<Identity> getIdentity() {
        return Optional.ofNullable(identity);
    }

    @Override
    public void assignIdentity(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (this.identity != null && !this.identity.equals(identity)) {
            throw new IllegalStateException(
                "identity already assigned: " + this.identity.getValue() + " (attempted: " + identity.getValue() + ")"
            );
        }
        this.identity = identity;
    }

    @Override
    public SystemAttributes getSystemAttributes() {
        return systemAttributes;
    }

    @Override
    public void applySystemAttributes(SystemAttributes systemAttributes) {
        if (systemAttributes == null) {
            throw new IllegalArgumentException("systemAttributes cannot be null");
        }
        this.systemAttributes = systemAttributes;
    }
}
