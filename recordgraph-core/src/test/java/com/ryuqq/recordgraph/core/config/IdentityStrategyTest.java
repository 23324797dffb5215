package com.ryuqq.recordgraph.core.config;

import com.ryuqq.recordgraph.core.fixture.Node;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.object.DescriptorFieldIntrospector;
import com.ryuqq.recordgraph.core.spi.FieldIntrospector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IdentityStrategy 테스트.
 */
class IdentityStrategyTest {

    private FieldIntrospector introspector;

    @BeforeEach
    void setUp() {
        introspector = new DescriptorFieldIntrospector(Node.registry());
    }

    @Test
    void storeGenerated_LeavesIdentityToStore() {
        assertEquals(Optional.empty(), IdentityStrategy.storeGenerated().identityFor(new Node("a"), introspector));
    }

    @Test
    void externallySupplied_GeneratesDistinctIdentities() {
        IdentityStrategy strategy = IdentityStrategy.externallySupplied();

        Identity first = strategy.identityFor(new Node("a"), introspector).orElseThrow();
        Identity second = strategy.identityFor(new Node("a"), introspector).orElseThrow();

        assertNotEquals(first, second);
    }

    @Test
    void custom_UsesGenerator() {
        IdentityStrategy strategy = IdentityStrategy.custom(object -> Identity.of("fixed"));

        assertEquals(Identity.of("fixed"), strategy.identityFor(new Node("a"), introspector).orElseThrow());
    }

    @Test
    void custom_GeneratorReturningNull_Fails() {
        IdentityStrategy strategy = IdentityStrategy.custom(object -> null);

        assertThrows(IllegalStateException.class, () -> strategy.identityFor(new Node("a"), introspector));
    }

    @Test
    void fromField_PrimitiveField() {
        Node node = new Node("alpha");

        Identity identity = IdentityStrategy.fromField("name").identityFor(node, introspector).orElseThrow();

        assertEquals(Identity.of("alpha"), identity);
    }

    @Test
    void fromField_DottedPathThroughReference() {
        Node node = new Node("outer");
        node.setNext(new Node("inner"));

        Identity identity = IdentityStrategy.fromField("next.name").identityFor(node, introspector).orElseThrow();

        assertEquals(Identity.of("inner"), identity);
    }

    @Test
    void fromField_PathEndingAtSavedObject_UsesItsIdentity() {
        Node node = new Node("outer");
        Node target = new Node("target");
        target.assignIdentity(Identity.of("target-id"));
        node.setNext(target);

        Identity identity = IdentityStrategy.fromField("next").identityFor(node, introspector).orElseThrow();

        assertEquals(Identity.of("target-id"), identity);
    }

    @Test
    void fromField_EnumUsesName() {
        Node node = new Node("n");
        node.setStatus(Node.Status.ACTIVE);

        assertEquals(Identity.of("ACTIVE"),
            IdentityStrategy.fromField("status").identityFor(node, introspector).orElseThrow());
    }

    @Test
    void fromField_UnknownOrNullField_Fails() {
        Node node = new Node("n");

        assertThrows(IllegalStateException.class,
            () -> IdentityStrategy.fromField("nope").identityFor(node, introspector));
        assertThrows(IllegalStateException.class,
            () -> IdentityStrategy.fromField("next.name").identityFor(node, introspector));
    }
}
