package com.ryuqq.recordgraph.core.cycle;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.object.FieldEntry;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.spi.FieldIntrospector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * 순환 참조 검출기.
 *
 * <p><strong>두 가지 검사:</strong></p>
 * <ul>
 *   <li>{@link #hasPathBackTo(Persistable, Persistable)}: 저장 시, 참조 대상에서 부모로
 *       돌아오는 경로가 있는지 (객체 동일성 기준)</li>
 *   <li>{@link #containsCycle(StoredRecord, Function)}: 조회 시, 저장된 레코드 그래프에
 *       현재 경로로 되돌아오는 참조가 있는지 (Identity 기준)</li>
 * </ul>
 *
 * <p>객체 비교는 {@link ObjectArena}의 정수 인덱스로 하며 equals를 사용하지 않습니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class CycleDetector {

    private final FieldIntrospector introspector;

    public CycleDetector(FieldIntrospector introspector) {
        if (introspector == null) {
            throw new IllegalArgumentException("introspector cannot be null");
        }
        this.introspector = introspector;
    }

    /**
     * candidate에서 참조 필드를 따라 root에 도달할 수 있는지 확인.
     *
     * <p>이미 방문한 노드(root 제외)는 그 가지를 끝냅니다. 따라서 root를 포함하지 않는
     * 순환은 허용됩니다.</p>
     *
     * @param candidate 탐색 시작 객체 (참조 대상)
     * @param root 찾는 객체 (부모)
     * @return 경로가 있으면 true
     */
    public boolean hasPathBackTo(Persistable candidate, Persistable root) {
        if (candidate == null || root == null) {
            throw new IllegalArgumentException("candidate and root cannot be null");
        }
        ObjectArena arena = new ObjectArena();
        int rootIndex = arena.indexOf(root);
        BitSet visited = new BitSet();
        Deque<Persistable> stack = new ArrayDeque<>();
        stack.push(candidate);

        while (!stack.isEmpty()) {
            Persistable node = stack.pop();
            int index = arena.indexOf(node);
            if (index == rootIndex) {
                return true;
            }
            if (visited.get(index)) {
                continue;
            }
            visited.set(index);
            List<Persistable> children = referencedObjects(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return false;
    }

    /**
     * 객체가 참조 필드(단일/리스트)로 직접 가리키는 객체 목록.
     *
     * @param object 객체
     * @return 참조 대상 (필드 순서)
     */
    public List<Persistable> referencedObjects(Persistable object) {
        List<Persistable> result = new ArrayList<>();
        for (FieldEntry entry : introspector.fieldsOf(object)) {
            Object value = entry.value();
            if (value instanceof Persistable persistable) {
                result.add(persistable);
            } else if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof Persistable persistable) {
                        result.add(persistable);
                    }
                }
            }
        }
        return result;
    }

    /**
     * 저장된 레코드 그래프에 순환이 있는지 확인.
     *
     * <p>lookup으로 찾을 수 없는 자식은 건너뜁니다.</p>
     *
     * @param record 시작 레코드 (Identity 필요)
     * @param lookup Identity → 레코드 (보통 캐시)
     * @return 현재 경로 위의 레코드를 가리키는 참조가 있으면 true
     */
    public boolean containsCycle(StoredRecord record, Function<Identity, Optional<StoredRecord>> lookup) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (lookup == null) {
            throw new IllegalArgumentException("lookup cannot be null");
        }
        Optional<Identity> identity = record.getIdentity();
        if (identity.isEmpty()) {
            return false;
        }
        return visit(identity.get(), record, lookup, new HashSet<>(), new HashSet<>());
    }

    private boolean visit(Identity identity, StoredRecord record,
                          Function<Identity, Optional<StoredRecord>> lookup,
                          Set<Identity> path, Set<Identity> finished) {
        path.add(identity);
        for (Identity child : record.referencedIdentities()) {
            if (path.contains(child)) {
                return true;
            }
            if (finished.contains(child)) {
                continue;
            }
            Optional<StoredRecord> childRecord = lookup.apply(child);
            if (childRecord.isPresent() && visit(child, childRecord.get(), lookup, path, finished)) {
                return true;
            }
        }
        path.remove(identity);
        finished.add(identity);
        return false;
    }
}
