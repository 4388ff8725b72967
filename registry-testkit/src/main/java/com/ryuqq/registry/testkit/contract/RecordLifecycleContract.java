package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.entity.SpeciesRecord;
import com.ryuqq.registry.core.error.RegistryErrorCode;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.statemachine.RecordState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: record lifecycle (NONEXISTENT → ACTIVE → INACTIVE).
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>End-to-end: grant, create, update, force-deactivate, rejected update</li>
 *   <li>Id allocation: sequential from 1, no id consumed by rejected calls</li>
 *   <li>Update: creator only, ACTIVE only</li>
 *   <li>Deactivate: creator or owner, ACTIVE only, irreversible</li>
 *   <li>Reads: getRecord, getContributorRecords, listRecords, recordCount</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class RecordLifecycleContract extends AbstractRegistryContractTest {

    // ========== End-to-End ==========

    @Test
    public void testFullLifecycle_GrantCreateUpdateDeactivate() {
        // Given: owner grants Alice
        registry.grantContributor(OWNER, ALICE, "Lab A");

        // When: Alice creates a record
        RecordId id = registry.createRecord(ALICE, "Rana temporaria", "wetlands", "hash1");

        // Then
        assertEquals(RecordId.of(1), id);
        SpeciesRecord created = registry.getRecord(id);
        assertEquals("Rana temporaria", created.scientificName());
        assertEquals("wetlands", created.habitat());
        assertEquals("hash1", created.dataHash());
        assertEquals(ALICE, created.creator());
        assertEquals(START_MILLIS, created.timestamp());
        assertEquals(RecordState.ACTIVE, created.state());

        // When: Alice updates later
        clock.advance(Duration.ofMinutes(5));
        registry.updateRecord(ALICE, id, "hash2");

        // Then: timestamp refreshed, identity fields unchanged
        SpeciesRecord updated = registry.getRecord(id);
        assertEquals("hash2", updated.dataHash());
        assertEquals(START_MILLIS + Duration.ofMinutes(5).toMillis(), updated.timestamp());
        assertEquals("Rana temporaria", updated.scientificName());
        assertEquals("wetlands", updated.habitat());
        assertEquals(ALICE, updated.creator());

        // When: owner deactivates
        registry.deactivateRecord(OWNER, id);

        // Then: further update by Alice fails
        assertFalse(registry.getRecord(id).isActive());
        assertRejectedWithoutEffect(RegistryErrorCode.INACTIVE,
                () -> registry.updateRecord(ALICE, id, "hash3"));
        assertEquals("hash2", registry.getRecord(id).dataHash());
    }

    // ========== Create ==========

    @Test
    public void testCreate_ByUnauthorized_AllocatesNoId() {
        // Given
        grant(ALICE, "Lab A");

        // When
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> createRecordAs(BOB, "Bufo bufo"));

        // Then: next successful create still gets id 1
        assertEquals(0L, registry.recordCount());
        assertEquals(RecordId.of(1), createRecordAs(ALICE, "Rana temporaria"));
    }

    @Test
    public void testCreate_SequentialByDifferentContributors_IdsStrictlyIncreasingFromOne() {
        // Given
        grant(ALICE, "Lab A");
        grant(BOB, "Lab B");

        // When
        RecordId first = createRecordAs(ALICE, "Rana temporaria");
        RecordId second = createRecordAs(BOB, "Bufo bufo");
        RecordId third = createRecordAs(ALICE, "Hyla arborea");

        // Then
        assertEquals(List.of(RecordId.of(1), RecordId.of(2), RecordId.of(3)), List.of(first, second, third));
        assertEquals(3L, registry.recordCount());
        assertEquals(List.of(first, third), registry.getContributorRecords(ALICE));
        assertEquals(List.of(second), registry.getContributorRecords(BOB));
    }

    @Test
    public void testCreate_BlankFields_RejectedInvalidArgument() {
        // Given
        grant(ALICE, "Lab A");

        // When & Then
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.createRecord(ALICE, "", "wetlands", "hash1"));
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.createRecord(ALICE, "Rana temporaria", null, "hash1"));
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.createRecord(ALICE, "Rana temporaria", "wetlands", "   "));
        assertEquals(0L, registry.recordCount());
    }

    @Test
    public void testCreate_ValuesStoredVerbatim() {
        // Given
        grant(ALICE, "Lab A");

        // When
        RecordId id = registry.createRecord(ALICE, " Rana  temporaria ", "alpine\tponds", "bafy-hash");

        // Then
        SpeciesRecord record = registry.getRecord(id);
        assertEquals(" Rana  temporaria ", record.scientificName());
        assertEquals("alpine\tponds", record.habitat());
    }

    // ========== Update ==========

    @Test
    public void testUpdate_ByOwnerNotCreator_RejectedForbidden() {
        // Given
        grant(ALICE, "Lab A");
        RecordId id = createRecordAs(ALICE, "Rana temporaria");

        // When & Then: owner has no bypass for update
        assertRejectedWithoutEffect(RegistryErrorCode.FORBIDDEN,
                () -> registry.updateRecord(OWNER, id, "owner-hash"));
    }

    @Test
    public void testUpdate_ByOtherContributor_RejectedForbidden() {
        // Given
        grant(ALICE, "Lab A");
        grant(BOB, "Lab B");
        RecordId id = createRecordAs(ALICE, "Rana temporaria");

        // When & Then
        assertRejectedWithoutEffect(RegistryErrorCode.FORBIDDEN,
                () -> registry.updateRecord(BOB, id, "bob-hash"));
        assertRejectedWithoutEffect(RegistryErrorCode.FORBIDDEN,
                () -> registry.updateRecord(null, id, "anonymous-hash"));
    }

    @Test
    public void testUpdate_BlankHash_RejectedInvalidArgument() {
        // Given
        grant(ALICE, "Lab A");
        RecordId id = createRecordAs(ALICE, "Rana temporaria");

        // When & Then
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.updateRecord(ALICE, id, ""));
    }

    @Test
    public void testUpdate_AbsentRecord_RejectedInactive() {
        // Given
        grant(ALICE, "Lab A");
        createRecordAs(ALICE, "Rana temporaria");

        // When & Then
        assertRejectedWithoutEffect(RegistryErrorCode.INACTIVE,
                () -> registry.updateRecord(ALICE, RecordId.ZERO, "hash"));
        assertRejectedWithoutEffect(RegistryErrorCode.INACTIVE,
                () -> registry.updateRecord(ALICE, RecordId.of(42), "hash"));
        assertRejectedWithoutEffect(RegistryErrorCode.INACTIVE,
                () -> registry.updateRecord(ALICE, null, "hash"));
    }

    @Test
    public void testUpdate_InactiveRecordByNonCreator_InactiveTakesPrecedence() {
        // Given
        grant(ALICE, "Lab A");
        RecordId id = createRecordAs(ALICE, "Rana temporaria");
        registry.deactivateRecord(ALICE, id);

        // When & Then
        assertRejected(RegistryErrorCode.INACTIVE, () -> registry.updateRecord(BOB, id, "hash"));
    }

    // ========== Deactivate ==========

    @Test
    public void testDeactivate_ByCreator_RecordInactiveTimestampKept() {
        // Given
        grant(ALICE, "Lab A");
        RecordId id = createRecordAs(ALICE, "Rana temporaria");
        clock.advance(Duration.ofHours(1));

        // When
        registry.deactivateRecord(ALICE, id);

        // Then
        SpeciesRecord record = registry.getRecord(id);
        assertEquals(RecordState.INACTIVE, record.state());
        assertEquals(START_MILLIS, record.timestamp());
    }

    @Test
    public void testDeactivate_ByOwnerOnOthersRecord_Succeeds() {
        // Given
        grant(ALICE, "Lab A");
        RecordId id = createRecordAs(ALICE, "Rana temporaria");

        // When
        registry.deactivateRecord(OWNER, id);

        // Then
        assertFalse(registry.getRecord(id).isActive());
        assertRejectedWithoutEffect(RegistryErrorCode.INACTIVE,
                () -> registry.deactivateRecord(OWNER, id));
        assertRejectedWithoutEffect(RegistryErrorCode.INACTIVE,
                () -> registry.deactivateRecord(ALICE, id));
    }

    @Test
    public void testDeactivate_ByOtherContributor_RejectedForbidden() {
        // Given
        grant(ALICE, "Lab A");
        grant(BOB, "Lab B");
        RecordId id = createRecordAs(ALICE, "Rana temporaria");

        // When & Then
        assertRejectedWithoutEffect(RegistryErrorCode.FORBIDDEN,
                () -> registry.deactivateRecord(BOB, id));
        assertTrue(registry.getRecord(id).isActive());
    }

    @Test
    public void testDeactivate_AbsentRecord_RejectedInactive() {
        assertRejectedWithoutEffect(RegistryErrorCode.INACTIVE,
                () -> registry.deactivateRecord(OWNER, RecordId.ZERO));
        assertRejectedWithoutEffect(RegistryErrorCode.INACTIVE,
                () -> registry.deactivateRecord(OWNER, RecordId.of(7)));
    }

    // ========== Reads ==========

    @Test
    public void testGetRecord_ZeroOrUnassigned_RejectedNotFound() {
        // Given
        grant(ALICE, "Lab A");
        createRecordAs(ALICE, "Rana temporaria");

        // When & Then
        assertRejected(RegistryErrorCode.NOT_FOUND, () -> registry.getRecord(RecordId.ZERO));
        assertRejected(RegistryErrorCode.NOT_FOUND, () -> registry.getRecord(RecordId.of(2)));
    }

    @Test
    public void testGetContributorRecords_KeepsDeactivatedIds() {
        // Given
        grant(ALICE, "Lab A");
        RecordId first = createRecordAs(ALICE, "Rana temporaria");
        RecordId second = createRecordAs(ALICE, "Bufo bufo");

        // When
        registry.deactivateRecord(OWNER, first);

        // Then
        assertEquals(List.of(first, second), registry.getContributorRecords(ALICE));
        assertTrue(registry.getContributorRecords(CAROL).isEmpty());
    }

    @Test
    public void testListRecords_FromZeroTreatedAsOne_IncludesInactive() {
        // Given
        grant(ALICE, "Lab A");
        grant(BOB, "Lab B");
        RecordId first = createRecordAs(ALICE, "Rana temporaria");
        RecordId second = createRecordAs(BOB, "Bufo bufo");
        RecordId third = createRecordAs(ALICE, "Hyla arborea");
        registry.deactivateRecord(BOB, second);

        // When
        List<SpeciesRecord> all = registry.listRecords(RecordId.ZERO, 10);
        List<SpeciesRecord> page = registry.listRecords(RecordId.of(2), 1);

        // Then
        assertEquals(List.of(first, second, third), all.stream().map(SpeciesRecord::id).toList());
        assertEquals(RecordState.INACTIVE, all.get(1).state());
        assertEquals(1, page.size());
        assertEquals(second, page.get(0).id());
        assertTrue(registry.listRecords(RecordId.of(4), 10).isEmpty());
    }

    @Test
    public void testListRecords_InvalidArguments_RejectedInvalidArgument() {
        assertRejected(RegistryErrorCode.INVALID_ARGUMENT, () -> registry.listRecords(RecordId.ZERO, 0));
        assertRejected(RegistryErrorCode.INVALID_ARGUMENT, () -> registry.listRecords(null, 10));
    }
}
