package com.ryuqq.recordgraph.application.save;

import com.ryuqq.recordgraph.core.object.Persistable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 하나의 최상위 저장과 그 하위 저장들이 공유하는 상태.
 *
 * <p>현재 저장 중인 객체를 객체 동일성으로 추적합니다. 이미 체인 위에 있는 객체를 다시
 * 저장하려 하면 재귀 대신 참조를 바로 쓰거나 지연합니다.</p>
 *
 * <p>Identity가 있어도 Store에 아직 없는 객체(upsert 생성)는 첫 저장 전까지 주소를 가진 것으로
 * 보지 않습니다.</p>
 */
final class SaveChain {

    private final Set<Persistable> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Persistable> unpersisted = Collections.newSetFromMap(new IdentityHashMap<>());

    void enter(Persistable object) {
        inProgress.add(object);
    }

    void leave(Persistable object) {
        inProgress.remove(object);
    }

    boolean contains(Persistable object) {
        return inProgress.contains(object);
    }

    void markUnpersisted(Persistable object) {
        unpersisted.add(object);
    }

    void markPersisted(Persistable object) {
        unpersisted.remove(object);
    }

    /**
     * 다른 레코드가 참조해도 되는지 (Identity가 있고 Store에 존재).
     */
    boolean isAddressable(Persistable object) {
        return object.getIdentity().isPresent() && !unpersisted.contains(object);
    }
}
