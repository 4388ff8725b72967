package com.ryuqq.registry.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecordId Value Object 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class RecordIdTest {

    @Test
    void of_Zero_ReturnsSentinel() {
        assertSame(RecordId.ZERO, RecordId.of(0));
        assertTrue(RecordId.ZERO.isZero());
    }

    @Test
    void of_Negative_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RecordId.of(-1)
        );
        assertTrue(exception.getMessage().contains("non-negative"));
    }

    @Test
    void next_IncrementsByOne() {
        // When
        RecordId first = RecordId.ZERO.next();
        RecordId second = first.next();

        // Then
        assertEquals(RecordId.of(1), first);
        assertEquals(2L, second.getValue());
        assertFalse(first.isZero());
    }

    @Test
    void next_AtMaxValue_ThrowsArithmeticException() {
        assertThrows(ArithmeticException.class, () -> RecordId.of(Long.MAX_VALUE).next());
    }

    @Test
    void compareTo_OrdersByValue() {
        assertTrue(RecordId.of(1).compareTo(RecordId.of(2)) < 0);
        assertTrue(RecordId.of(10).compareTo(RecordId.of(2)) > 0);
        assertEquals(0, RecordId.of(5).compareTo(RecordId.of(5)));
    }
}
