package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.adapter.runner.RegistryConfig;
import com.ryuqq.registry.adapter.runner.SerializedRegistry;
import com.ryuqq.registry.application.registry.Registry;
import com.ryuqq.registry.core.entity.SpeciesRecord;
import com.ryuqq.registry.core.error.RegistryErrorCode;
import com.ryuqq.registry.core.event.OwnershipTransferred;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: owner initialization and transfer.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Owner set once from configuration, an existing store owner wins</li>
 *   <li>Transfer moves grant/revoke and force-deactivate rights</li>
 *   <li>Transfer guards: owner only, enabled by configuration, non-zero target</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class OwnershipContract extends AbstractRegistryContractTest {

    @Test
    public void testOwner_InitializedFromConfig() {
        assertEquals(OWNER, registry.owner());
        assertEquals(OWNER, store.getOwner());
    }

    @Test
    public void testOwner_ExistingStoreOwnerKept() {
        // When: a second registry over the same store is configured with another owner
        Registry reopened = new SerializedRegistry(store, eventBus, RegistryConfig.of(BOB), clock);

        // Then
        assertEquals(OWNER, reopened.owner());
        assertEquals(0, events.size(), "Owner initialization emits no event");
    }

    @Test
    public void testTransfer_ByOwner_RightsMoveToNewOwner() {
        // Given
        grant(ALICE, "Lab A");
        RecordId first = createRecordAs(ALICE, "Rana temporaria");
        RecordId second = createRecordAs(ALICE, "Bufo bufo");
        SpeciesRecord before = registry.getRecord(first);

        // When
        registry.transferOwnership(OWNER, CAROL);

        // Then: the new owner manages contributors and force-deactivates
        assertEquals(CAROL, registry.owner());
        registry.grantContributor(CAROL, BOB, "Lab B");
        assertContributor(BOB, "Lab B", true);
        registry.deactivateRecord(CAROL, second);
        assertFalse(registry.getRecord(second).isActive());

        // Then: the previous owner lost every owner right
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> registry.revokeContributor(OWNER, ALICE));
        assertRejectedWithoutEffect(RegistryErrorCode.FORBIDDEN,
                () -> registry.deactivateRecord(OWNER, first));
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> registry.transferOwnership(OWNER, OWNER));

        // Then: past records untouched
        assertEquals(before, registry.getRecord(first));
    }

    @Test
    public void testTransfer_EmitsOwnershipTransferred() {
        // When
        registry.transferOwnership(OWNER, CAROL);

        // Then
        assertEquals(new OwnershipTransferred(OWNER, CAROL, START_MILLIS), events.last());
    }

    @Test
    public void testTransfer_ToSelf_Allowed() {
        // When
        registry.transferOwnership(OWNER, OWNER);

        // Then
        assertEquals(OWNER, registry.owner());
        assertEquals(1, events.size());
    }

    @Test
    public void testTransfer_ByNonOwner_RejectedUnauthorized() {
        // Given
        grant(ALICE, "Lab A");

        // When & Then
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> registry.transferOwnership(ALICE, ALICE));
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> registry.transferOwnership(null, ALICE));
    }

    @Test
    public void testTransfer_ZeroOrNullTarget_RejectedInvalidArgument() {
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.transferOwnership(OWNER, Identity.ZERO));
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.transferOwnership(OWNER, null));
    }

    @Test
    public void testTransfer_DisabledByConfig_RejectedForbidden() {
        // Given
        Registry locked = new SerializedRegistry(
            newStore(), newEventBus(), RegistryConfig.of(OWNER).withOwnershipTransferable(false), clock);

        // When & Then
        assertRejected(RegistryErrorCode.FORBIDDEN, () -> locked.transferOwnership(OWNER, CAROL));
        assertRejected(RegistryErrorCode.UNAUTHORIZED, () -> locked.transferOwnership(CAROL, CAROL));
        assertEquals(OWNER, locked.owner());
    }
}
