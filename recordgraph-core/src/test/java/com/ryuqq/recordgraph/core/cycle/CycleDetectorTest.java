package com.ryuqq.recordgraph.core.cycle;

import com.ryuqq.recordgraph.core.fixture.Node;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.ReferenceList;
import com.ryuqq.recordgraph.core.model.ReferenceValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.object.DescriptorFieldIntrospector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CycleDetector 테스트.
 */
class CycleDetectorTest {

    private CycleDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CycleDetector(new DescriptorFieldIntrospector(Node.registry()));
    }

    @Test
    void hasPathBackTo_DirectCycle_True() {
        // Given
        Node a = new Node("a");
        Node b = new Node("b");
        a.setNext(b);
        b.setNext(a);

        // When & Then
        assertTrue(detector.hasPathBackTo(b, a));
    }

    @Test
    void hasPathBackTo_ThroughReferenceList_True() {
        // Given
        Node parent = new Node("parent");
        Node child = new Node("child");
        Node grandChild = new Node("grand");
        parent.setNext(child);
        child.setChildren(List.of(new Node("other"), grandChild));
        grandChild.setNext(parent);

        // When & Then
        assertTrue(detector.hasPathBackTo(child, parent));
    }

    @Test
    void hasPathBackTo_TreeWithoutReturn_False() {
        // Given
        Node root = new Node("root");
        Node leaf = new Node("leaf");
        root.setNext(leaf);

        // When & Then
        assertFalse(detector.hasPathBackTo(leaf, root));
    }

    @Test
    void hasPathBackTo_CycleNotInvolvingRoot_False() {
        // Given
        Node root = new Node("root");
        Node x = new Node("x");
        Node y = new Node("y");
        root.setNext(x);
        x.setNext(y);
        y.setNext(x);

        // When & Then
        assertFalse(detector.hasPathBackTo(x, root));
    }

    @Test
    void hasPathBackTo_ComparesObjectIdentityNotEquality() {
        // Given
        Node root = new Node("same");
        Node lookalike = new Node("same");
        Node candidate = new Node("candidate");
        candidate.setNext(lookalike);

        // When & Then
        assertFalse(detector.hasPathBackTo(candidate, root));
    }

    @Test
    void containsCycle_StoredBackReference_True() {
        // Given
        Map<Identity, StoredRecord> records = new HashMap<>();
        StoredRecord a = record("a", "b");
        StoredRecord b = record("b", "a");
        records.put(Identity.of("a"), a);
        records.put(Identity.of("b"), b);

        // When & Then
        assertTrue(detector.containsCycle(a, id -> Optional.ofNullable(records.get(id))));
    }

    @Test
    void containsCycle_Diamond_False() {
        // Given: a → [b, c], b → d, c → d
        Map<Identity, StoredRecord> records = new HashMap<>();
        StoredRecord a = StoredRecord.builder("Node").identity(Identity.of("a"))
            .field("children", ReferenceList.of(List.of(Identity.of("b"), Identity.of("c")))).build();
        records.put(Identity.of("a"), a);
        records.put(Identity.of("b"), record("b", "d"));
        records.put(Identity.of("c"), record("c", "d"));
        records.put(Identity.of("d"), StoredRecord.builder("Node").identity(Identity.of("d")).build());

        // When & Then
        assertFalse(detector.containsCycle(a, id -> Optional.ofNullable(records.get(id))));
    }

    @Test
    void containsCycle_UnresolvableChild_Skipped() {
        StoredRecord a = record("a", "missing");

        assertFalse(detector.containsCycle(a, id -> Optional.empty()));
    }

    @Test
    void referencedObjects_SingleAndListInFieldOrder() {
        // Given
        Node root = new Node("root");
        Node next = new Node("next");
        Node child = new Node("child");
        root.setNext(next);
        root.setChildren(List.of(child));

        // When
        List<?> referenced = detector.referencedObjects(root);

        // Then
        assertEquals(2, referenced.size());
        assertSame(next, referenced.get(0));
        assertSame(child, referenced.get(1));
    }

    private static StoredRecord record(String identity, String next) {
        return StoredRecord.builder("Node")
            .identity(Identity.of(identity))
            .field("next", ReferenceValue.to(Identity.of(next)))
            .build();
    }
}
