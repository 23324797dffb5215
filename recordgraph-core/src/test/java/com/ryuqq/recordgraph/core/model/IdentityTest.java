package com.ryuqq.recordgraph.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Identity Value Object 테스트.
 */
class IdentityTest {

    @Test
    void of_ValidValue_CreatesIdentity() {
        // When
        Identity identity = Identity.of("rec-123");

        // Then
        assertEquals("rec-123", identity.getValue());
        assertEquals(Identity.of("rec-123"), identity);
        assertEquals(Identity.of("rec-123").hashCode(), identity.hashCode());
    }

    @Test
    void of_BlankValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> Identity.of("  "));
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Identity.of("x".repeat(256)));
        assertEquals(255, Identity.of("x".repeat(255)).getValue().length());
    }
}
