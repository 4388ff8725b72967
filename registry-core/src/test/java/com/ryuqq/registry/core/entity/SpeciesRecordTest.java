package com.ryuqq.registry.core.entity;

import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.statemachine.RecordState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SpeciesRecord 엔티티 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class SpeciesRecordTest {

    private static final Identity CREATOR = Identity.of("0xALICE");

    private SpeciesRecord active() {
        return SpeciesRecord.create(RecordId.of(1), "Rana temporaria", "wetlands", "hash1", CREATOR, 100L);
    }

    @Test
    void create_ActiveWithGivenFields() {
        // When
        SpeciesRecord record = active();

        // Then
        assertEquals(RecordState.ACTIVE, record.state());
        assertTrue(record.isActive());
        assertEquals(100L, record.timestamp());
    }

    @Test
    void create_ZeroId_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> SpeciesRecord.create(RecordId.ZERO, "Rana temporaria", "wetlands", "hash1", CREATOR, 100L)
        );
        assertTrue(exception.getMessage().contains("id cannot be null or zero"));
    }

    @Test
    void create_BlankOrZeroFields_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> SpeciesRecord.create(RecordId.of(1), " ", "wetlands", "hash1", CREATOR, 100L));
        assertThrows(IllegalArgumentException.class,
            () -> SpeciesRecord.create(RecordId.of(1), "Rana temporaria", "", "hash1", CREATOR, 100L));
        assertThrows(IllegalArgumentException.class,
            () -> SpeciesRecord.create(RecordId.of(1), "Rana temporaria", "wetlands", null, CREATOR, 100L));
        assertThrows(IllegalArgumentException.class,
            () -> SpeciesRecord.create(RecordId.of(1), "Rana temporaria", "wetlands", "hash1", Identity.ZERO, 100L));
        assertThrows(IllegalArgumentException.class,
            () -> SpeciesRecord.create(RecordId.of(1), "Rana temporaria", "wetlands", "hash1", CREATOR, -1L));
    }

    @Test
    void constructor_NonexistentState_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new SpeciesRecord(RecordId.of(1), "Rana temporaria", "wetlands", "hash1", CREATOR, 0L, RecordState.NONEXISTENT));
    }

    @Test
    void withDataHash_ReplacesHashAndTimestampOnly() {
        // When
        SpeciesRecord updated = active().withDataHash("hash2", 200L);

        // Then
        assertEquals("hash2", updated.dataHash());
        assertEquals(200L, updated.timestamp());
        assertTrue(updated.hasSameIdentityAs(active()));
        assertEquals(RecordState.ACTIVE, updated.state());
    }

    @Test
    void withDataHash_OnInactive_ThrowsException() {
        // Given
        SpeciesRecord inactive = active().deactivate();

        // When & Then
        assertThrows(IllegalStateException.class, () -> inactive.withDataHash("hash2", 200L));
    }

    @Test
    void deactivate_KeepsTimestamp_SecondCallThrows() {
        // When
        SpeciesRecord inactive = active().deactivate();

        // Then
        assertEquals(RecordState.INACTIVE, inactive.state());
        assertEquals(100L, inactive.timestamp());
        assertThrows(IllegalStateException.class, inactive::deactivate);
    }

    @Test
    void hasSameIdentityAs_IgnoresMutableFields() {
        // Given
        SpeciesRecord base = active();
        SpeciesRecord otherHabitat = new SpeciesRecord(
            base.id(), base.scientificName(), "forest", base.dataHash(), base.creator(), base.timestamp(), base.state());

        // Then
        assertTrue(base.hasSameIdentityAs(base.withDataHash("hash9", 999L)));
        assertTrue(base.hasSameIdentityAs(base.deactivate()));
        assertFalse(base.hasSameIdentityAs(otherHabitat));
        assertFalse(base.hasSameIdentityAs(null));
    }
}
