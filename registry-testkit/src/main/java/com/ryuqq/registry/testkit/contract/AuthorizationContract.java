package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.entity.Contributor;
import com.ryuqq.registry.core.error.RegistryErrorCode;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: contributor authorization.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Unknown identities read as (empty name, unauthorized)</li>
 *   <li>Only the owner grants and revokes</li>
 *   <li>Grant/revoke guards (already authorized / not authorized)</li>
 *   <li>Revocation keeps the name, re-grant replaces it</li>
 *   <li>Revocation removes the right to create, not the right to amend own records</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class AuthorizationContract extends AbstractRegistryContractTest {

    @Test
    public void testGetContributor_NeverGranted_ReturnsUnauthorizedWithEmptyName() {
        assertContributor(ALICE, "", false);
        assertContributor(Identity.ZERO, "", false);
    }

    @Test
    public void testGetContributor_NullIdentity_RejectedInvalidArgument() {
        assertRejected(RegistryErrorCode.INVALID_ARGUMENT, () -> registry.getContributor(null));
    }

    @Test
    public void testGrant_ByOwner_ContributorAuthorized() {
        // When
        registry.grantContributor(OWNER, ALICE, "Lab A");

        // Then
        assertContributor(ALICE, "Lab A", true);
        assertContributor(BOB, "", false);
    }

    @Test
    public void testGrant_ByNonOwner_RejectedUnauthorized() {
        // Given
        grant(ALICE, "Lab A");

        // When & Then: even an authorized contributor cannot grant
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> registry.grantContributor(ALICE, BOB, "Lab B"));
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> registry.grantContributor(null, BOB, "Lab B"));
    }

    @Test
    public void testGrant_AlreadyAuthorized_RejectedWithoutEffect() {
        // Given
        grant(ALICE, "Lab A");

        // When & Then: name is not overwritten
        assertRejectedWithoutEffect(RegistryErrorCode.ALREADY_AUTHORIZED,
                () -> registry.grantContributor(OWNER, ALICE, "Lab A2"));
        assertContributor(ALICE, "Lab A", true);
    }

    @Test
    public void testGrant_InvalidArguments_RejectedInvalidArgument() {
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.grantContributor(OWNER, null, "Lab A"));
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.grantContributor(OWNER, Identity.ZERO, "Lab A"));
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.grantContributor(OWNER, ALICE, " "));
        assertRejectedWithoutEffect(RegistryErrorCode.INVALID_ARGUMENT,
                () -> registry.grantContributor(OWNER, ALICE, null));
    }

    @Test
    public void testGrant_ByNonOwnerWithInvalidArguments_UnauthorizedTakesPrecedence() {
        assertRejected(RegistryErrorCode.UNAUTHORIZED,
                () -> registry.grantContributor(BOB, Identity.ZERO, ""));
    }

    @Test
    public void testRevoke_AfterGrant_FlagClearedNamePersists() {
        // Given
        grant(ALICE, "Lab A");

        // When
        registry.revokeContributor(OWNER, ALICE);

        // Then
        assertContributor(ALICE, "Lab A", false);
    }

    @Test
    public void testRevoke_NotAuthorized_RejectedNotAuthorized() {
        assertRejectedWithoutEffect(RegistryErrorCode.NOT_AUTHORIZED,
                () -> registry.revokeContributor(OWNER, ALICE));
        assertRejectedWithoutEffect(RegistryErrorCode.NOT_AUTHORIZED,
                () -> registry.revokeContributor(OWNER, Identity.ZERO));
        assertRejectedWithoutEffect(RegistryErrorCode.NOT_AUTHORIZED,
                () -> registry.revokeContributor(OWNER, null));
    }

    @Test
    public void testRevoke_Twice_SecondRejectedNotAuthorized() {
        // Given
        grant(ALICE, "Lab A");
        registry.revokeContributor(OWNER, ALICE);

        // When & Then
        assertRejectedWithoutEffect(RegistryErrorCode.NOT_AUTHORIZED,
                () -> registry.revokeContributor(OWNER, ALICE));
    }

    @Test
    public void testRevoke_ByNonOwner_RejectedUnauthorized() {
        // Given
        grant(ALICE, "Lab A");
        grant(BOB, "Lab B");

        // When & Then
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> registry.revokeContributor(BOB, ALICE));
        assertContributor(ALICE, "Lab A", true);
    }

    @Test
    public void testRegrant_AfterRevoke_AuthorizedWithNewName() {
        // Given
        grant(ALICE, "Lab A");
        registry.revokeContributor(OWNER, ALICE);

        // When
        registry.grantContributor(OWNER, ALICE, "Lab A (renamed)");

        // Then
        assertContributor(ALICE, "Lab A (renamed)", true);
    }

    @Test
    public void testCreateRecord_ByOwnerNotGranted_RejectedUnauthorized() {
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> createRecordAs(OWNER, "Rana temporaria"));
    }

    @Test
    public void testCreateRecord_AfterRevoke_RejectedUnauthorized() {
        // Given
        grant(ALICE, "Lab A");
        createRecordAs(ALICE, "Rana temporaria");
        registry.revokeContributor(OWNER, ALICE);

        // When & Then
        assertRejectedWithoutEffect(RegistryErrorCode.UNAUTHORIZED,
                () -> createRecordAs(ALICE, "Bufo bufo"));
        assertEquals(1L, registry.recordCount());
    }

    @Test
    public void testRevokedContributor_StillAmendsOwnRecords() {
        // Given
        grant(ALICE, "Lab A");
        RecordId first = createRecordAs(ALICE, "Rana temporaria");
        RecordId second = createRecordAs(ALICE, "Bufo bufo");
        registry.revokeContributor(OWNER, ALICE);

        // When
        registry.updateRecord(ALICE, first, "hash-after-revoke");
        registry.deactivateRecord(ALICE, second);

        // Then
        assertEquals("hash-after-revoke", registry.getRecord(first).dataHash());
        assertFalse(registry.getRecord(second).isActive());
        assertEquals(List.of(first, second), registry.getContributorRecords(ALICE));
    }

    @Test
    public void testContributorEntry_IsNeverDeleted() {
        // Given
        grant(ALICE, "Lab A");
        registry.revokeContributor(OWNER, ALICE);

        // When
        Contributor contributor = registry.getContributor(ALICE);

        // Then: distinguishable from an identity that was never granted
        assertNotEquals(Contributor.unknown(ALICE), contributor);
    }
}
