package com.ryuqq.recordgraph.core.object;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.SystemAttributes;

import java.util.Optional;

/**
 * 저장 가능한 애플리케이션 객체 계약.
 *
 * <p>도메인 필드는 {@link TypeDescriptor}로 기술하고, 이 인터페이스는 Store가 부여하는
 * Identity와 시스템 속성만 다룹니다. 대부분의 도메인 타입은 {@link AbstractPersistable}을
 * 상속하면 충분합니다.</p>
 *
 * <p><strong>불변 조건:</strong> Identity는 한 번 부여되면 다른 값으로 바뀌지 않습니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public interface Persistable {

    /**
     * Identity 조회.
     *
     * @return Identity (아직 저장 전이면 empty)
     */
    Optional<Identity> getIdentity();

    /**
     * Identity 부여.
     *
     * <p>같은 Identity를 다시 부여하는 것은 허용됩니다.</p>
     *
     * @param identity 부여할 Identity
     * @throws IllegalArgumentException identity가 null인 경우
     * @throws IllegalStateException 이미 다른 Identity가 부여된 경우
     */
    void assignIdentity(Identity identity);

    SystemAttributes getSystemAttributes();

    /**
     * Store가 돌려준 시스템 속성 반영.
     *
     * @param systemAttributes 시스템 속성
     */
    void applySystemAttributes(SystemAttributes systemAttributes);
}
