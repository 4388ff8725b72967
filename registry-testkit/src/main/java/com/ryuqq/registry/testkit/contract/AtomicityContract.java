package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.entity.Contributor;
import com.ryuqq.registry.core.entity.SpeciesRecord;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.spi.Changeset;
import com.ryuqq.registry.core.statemachine.RecordState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: all-or-nothing changeset commits.
 *
 * <p>These tests talk to the store directly, bypassing the registry's precondition
 * checks, to verify that the store itself refuses changesets that would break record
 * invariants and applies none of their writes.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Valid multi-write changeset → every write visible</li>
 *   <li>Non-sequential new id → rejected, earlier writes of the same changeset discarded</li>
 *   <li>Immutable field change → rejected</li>
 *   <li>Inactive record reactivation or amendment → rejected</li>
 *   <li>Index entry of a foreign or unknown record → rejected</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class AtomicityContract extends AbstractRegistryContractTest {

    private SpeciesRecord newRecord(long id, String scientificName) {
        return SpeciesRecord.create(RecordId.of(id), scientificName, "wetland", hashOf(scientificName), ALICE, START_MILLIS);
    }

    @Test
    public void testCommit_ValidChangeset_AllWritesVisible() {
        // Given
        SpeciesRecord record = newRecord(1, "Rana temporaria");
        Changeset changeset = Changeset.builder()
            .putContributor(Contributor.authorized(ALICE, "Lab A"))
            .putRecord(record)
            .appendToIndex(ALICE, record.id())
            .build();

        // When
        store.commit(changeset);

        // Then
        assertEquals(Contributor.authorized(ALICE, "Lab A"), store.findContributor(ALICE));
        assertEquals(record, store.findRecord(record.id()));
        assertEquals(List.of(record.id()), store.findRecordIdsByCreator(ALICE));
        assertEquals(record.id(), store.lastRecordId());
    }

    @Test
    public void testCommit_EmptyChangeset_NoOp() {
        // When
        store.commit(Changeset.builder().build());

        // Then
        assertEquals(OWNER, store.getOwner());
        assertEquals(RecordId.ZERO, store.lastRecordId());
    }

    @Test
    public void testCommit_NonSequentialId_NothingApplied() {
        // Given: a contributor write followed by a record skipping id 1
        Changeset changeset = Changeset.builder()
            .putContributor(Contributor.authorized(ALICE, "Lab A"))
            .putRecord(newRecord(2, "Rana temporaria"))
            .build();

        // When & Then
        assertThrows(IllegalStateException.class, () -> store.commit(changeset));
        assertNull(store.findContributor(ALICE), "Contributor write must be discarded");
        assertNull(store.findRecord(RecordId.of(2)));
        assertEquals(RecordId.ZERO, store.lastRecordId());
    }

    @Test
    public void testCommit_TwoNewRecordsInOrder_BothApplied() {
        // When
        store.commit(Changeset.builder()
            .putRecord(newRecord(1, "Rana temporaria"))
            .putRecord(newRecord(2, "Bufo bufo"))
            .appendToIndex(ALICE, RecordId.of(1))
            .appendToIndex(ALICE, RecordId.of(2))
            .build());

        // Then
        assertEquals(RecordId.of(2), store.lastRecordId());
        assertEquals(List.of(RecordId.of(1), RecordId.of(2)), store.findRecordIdsByCreator(ALICE));
    }

    @Test
    public void testCommit_NewRecordInactive_Rejected() {
        // Given
        SpeciesRecord inactive = new SpeciesRecord(
            RecordId.of(1), "Rana temporaria", "wetland", "hash", ALICE, START_MILLIS, RecordState.INACTIVE);

        // When & Then
        assertThrows(IllegalStateException.class,
                () -> store.commit(Changeset.builder().putRecord(inactive).build()));
        assertNull(store.findRecord(RecordId.of(1)));
    }

    @Test
    public void testCommit_ImmutableFieldChanged_NothingApplied() {
        // Given
        SpeciesRecord original = newRecord(1, "Rana temporaria");
        store.commit(Changeset.builder().putRecord(original).appendToIndex(ALICE, original.id()).build());

        SpeciesRecord renamed = new SpeciesRecord(
            original.id(), "Rana arvalis", original.habitat(), original.dataHash(),
            original.creator(), original.timestamp(), original.state());
        SpeciesRecord stolen = new SpeciesRecord(
            original.id(), original.scientificName(), original.habitat(), original.dataHash(),
            BOB, original.timestamp(), original.state());

        // When & Then
        assertThrows(IllegalStateException.class,
                () -> store.commit(Changeset.builder()
                        .putContributor(Contributor.authorized(CAROL, "Lab C"))
                        .putRecord(renamed)
                        .build()));
        assertThrows(IllegalStateException.class,
                () -> store.commit(Changeset.builder().putRecord(stolen).build()));

        assertEquals(original, store.findRecord(original.id()));
        assertNull(store.findContributor(CAROL));
    }

    @Test
    public void testCommit_InactiveRecordChanged_Rejected() {
        // Given
        SpeciesRecord original = newRecord(1, "Rana temporaria");
        store.commit(Changeset.builder().putRecord(original).build());
        SpeciesRecord deactivated = original.deactivate();
        store.commit(Changeset.builder().putRecord(deactivated).build());

        SpeciesRecord reactivated = new SpeciesRecord(
            original.id(), original.scientificName(), original.habitat(), original.dataHash(),
            original.creator(), original.timestamp(), RecordState.ACTIVE);
        SpeciesRecord amended = new SpeciesRecord(
            original.id(), original.scientificName(), original.habitat(), "late-hash",
            original.creator(), original.timestamp(), RecordState.INACTIVE);

        // When & Then
        assertThrows(IllegalStateException.class,
                () -> store.commit(Changeset.builder().putRecord(reactivated).build()));
        assertThrows(IllegalStateException.class,
                () -> store.commit(Changeset.builder().putRecord(amended).build()));
        assertEquals(deactivated, store.findRecord(original.id()));
    }

    @Test
    public void testCommit_IndexEntryForeignOrUnknownRecord_Rejected() {
        // Given
        SpeciesRecord record = newRecord(1, "Rana temporaria");
        store.commit(Changeset.builder().putRecord(record).appendToIndex(ALICE, record.id()).build());

        // When & Then
        assertThrows(IllegalStateException.class,
                () -> store.commit(Changeset.builder().appendToIndex(BOB, record.id()).build()));
        assertThrows(IllegalStateException.class,
                () -> store.commit(Changeset.builder().appendToIndex(ALICE, RecordId.of(9)).build()));
        assertThrows(IllegalStateException.class,
                () -> store.commit(Changeset.builder().appendToIndex(ALICE, record.id()).build()));

        assertEquals(List.of(record.id()), store.findRecordIdsByCreator(ALICE));
        assertTrue(store.findRecordIdsByCreator(BOB).isEmpty());
    }

    @Test
    public void testCommit_ZeroIdentityContributor_Rejected() {
        assertThrows(IllegalStateException.class,
                () -> store.commit(Changeset.builder()
                        .putContributor(Contributor.authorized(Identity.ZERO, "nobody"))
                        .build()));
    }

    @Test
    public void testIndexSnapshot_NotAffectedByLaterAppends() {
        // Given
        store.commit(Changeset.builder().putRecord(newRecord(1, "Rana temporaria")).appendToIndex(ALICE, RecordId.of(1)).build());
        List<RecordId> snapshot = store.findRecordIdsByCreator(ALICE);

        // When
        store.commit(Changeset.builder().putRecord(newRecord(2, "Bufo bufo")).appendToIndex(ALICE, RecordId.of(2)).build());

        // Then
        assertEquals(List.of(RecordId.of(1)), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(RecordId.of(3)));
    }
}
