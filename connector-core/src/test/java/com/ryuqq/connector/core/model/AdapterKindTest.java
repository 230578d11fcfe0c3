package com.ryuqq.connector.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AdapterKind Value Object 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class AdapterKindTest {

    @Test
    void of_ValidValue_CreatesAdapterKind() {
        AdapterKind kind = AdapterKind.of("D365CommerceAdapter");

        assertEquals("D365CommerceAdapter", kind.getValue());
    }

    @Test
    void of_ValueWithDotsAndHyphens_CreatesAdapterKind() {
        AdapterKind kind = AdapterKind.of("in-memory.wishlist_v2");

        assertEquals("in-memory.wishlist_v2", kind.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> AdapterKind.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> AdapterKind.of("D365 Commerce/Adapter")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        String value = "a".repeat(129);

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> AdapterKind.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 128"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        assertEquals(AdapterKind.of("MockAdapter"), AdapterKind.of("MockAdapter"));
        assertEquals(AdapterKind.of("MockAdapter").hashCode(), AdapterKind.of("MockAdapter").hashCode());
    }

    @Test
    void toString_ContainsValue() {
        assertEquals("AdapterKind{MockAdapter}", AdapterKind.of("MockAdapter").toString());
    }
}
