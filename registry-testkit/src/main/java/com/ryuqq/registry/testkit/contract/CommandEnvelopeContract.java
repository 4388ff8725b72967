package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.adapter.runner.EnvelopeCommandHandler;
import com.ryuqq.registry.application.command.RegistryCommandHandler;
import com.ryuqq.registry.core.contract.CreateRecord;
import com.ryuqq.registry.core.contract.DeactivateRecord;
import com.ryuqq.registry.core.contract.Envelope;
import com.ryuqq.registry.core.contract.GrantContributor;
import com.ryuqq.registry.core.contract.RegistryCommand;
import com.ryuqq.registry.core.contract.RevokeContributor;
import com.ryuqq.registry.core.contract.TransferOwnership;
import com.ryuqq.registry.core.contract.UpdateRecord;
import com.ryuqq.registry.core.error.RegistryErrorCode;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.outcome.Fail;
import com.ryuqq.registry.core.outcome.Ok;
import com.ryuqq.registry.core.outcome.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: envelope command entry point over a live registry.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Every command type applied through {@link Envelope}s</li>
 *   <li>CREATE_RECORD outcome carries the allocated id</li>
 *   <li>Registry errors become {@link Fail} outcomes, state unchanged</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class CommandEnvelopeContract extends AbstractRegistryContractTest {

    protected RegistryCommandHandler handler;

    @BeforeEach
    protected void setUpHandler() {
        handler = new EnvelopeCommandHandler(registry);
    }

    private Outcome send(Identity caller, RegistryCommand command) {
        return handler.handle(Envelope.of(caller, command, clock.millis()));
    }

    @Test
    public void testEnvelopes_FullLifecycle_AllOk() {
        // When
        Outcome granted = send(OWNER, new GrantContributor(ALICE, "Lab A"));
        Outcome created = send(ALICE, new CreateRecord("Rana temporaria", "wetlands", "hash1"));
        Outcome updated = send(ALICE, new UpdateRecord(RecordId.of(1), "hash2"));
        Outcome deactivated = send(OWNER, new DeactivateRecord(RecordId.of(1)));
        Outcome revoked = send(OWNER, new RevokeContributor(ALICE));
        Outcome transferred = send(OWNER, new TransferOwnership(CAROL));

        // Then
        assertEquals(Ok.of("GRANT_CONTRIBUTOR"), granted);
        assertEquals(Ok.created("CREATE_RECORD", RecordId.of(1)), created);
        assertEquals(Ok.of("UPDATE_RECORD"), updated);
        assertEquals(Ok.of("DEACTIVATE_RECORD"), deactivated);
        assertEquals(Ok.of("REVOKE_CONTRIBUTOR"), revoked);
        assertEquals(Ok.of("TRANSFER_OWNERSHIP"), transferred);

        assertEquals("hash2", registry.getRecord(RecordId.of(1)).dataHash());
        assertFalse(registry.getRecord(RecordId.of(1)).isActive());
        assertContributor(ALICE, "Lab A", false);
        assertEquals(CAROL, registry.owner());
        assertEquals(6, events.size());
    }

    @Test
    public void testEnvelope_Rejected_ReturnsFailWithoutEffect() {
        // Given
        Snapshot before = snapshot();

        // When
        Outcome outcome = send(BOB, new CreateRecord("Bufo bufo", "forest", "hash"));

        // Then
        assertTrue(outcome.isFail());
        Fail fail = (Fail) outcome;
        assertEquals(RegistryErrorCode.UNAUTHORIZED, fail.errorCode());
        assertFalse(fail.message().isBlank());
        assertEquals(before, snapshot());
        assertEquals(0, events.size());
    }

    @Test
    public void testEnvelope_InvalidPayload_ReturnsFailInvalidArgument() {
        // Given
        send(OWNER, new GrantContributor(ALICE, "Lab A"));

        // When
        Outcome outcome = send(ALICE, new CreateRecord("Rana temporaria", "", "hash1"));

        // Then
        assertEquals(RegistryErrorCode.INVALID_ARGUMENT, ((Fail) outcome).errorCode());
        assertEquals(0L, registry.recordCount());
    }
}
