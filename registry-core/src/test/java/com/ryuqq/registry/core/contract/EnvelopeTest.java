package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Envelope / RegistryCommand 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class EnvelopeTest {

    private static final Identity CALLER = Identity.of("0xALICE");

    @Test
    void of_ValidArguments_CreatesEnvelope() {
        // Given
        RegistryCommand command = new UpdateRecord(RecordId.of(1), "hash2");

        // When
        Envelope envelope = Envelope.of(CALLER, command, 1234L);

        // Then
        assertEquals(CALLER, envelope.caller());
        assertSame(command, envelope.command());
        assertEquals(1234L, envelope.acceptedAt());
    }

    @Test
    void constructor_InvalidArguments_ThrowsException() {
        RegistryCommand command = new RevokeContributor(CALLER);

        assertThrows(IllegalArgumentException.class, () -> Envelope.of(null, command, 0L));
        assertThrows(IllegalArgumentException.class, () -> Envelope.of(CALLER, null, 0L));
        assertThrows(IllegalArgumentException.class, () -> Envelope.of(CALLER, command, -1L));
    }

    @Test
    void commandName_PerCommandType() {
        assertEquals("GRANT_CONTRIBUTOR", new GrantContributor(CALLER, "Lab A").commandName());
        assertEquals("REVOKE_CONTRIBUTOR", new RevokeContributor(CALLER).commandName());
        assertEquals("CREATE_RECORD", new CreateRecord("Rana temporaria", "wetlands", "hash1").commandName());
        assertEquals("UPDATE_RECORD", new UpdateRecord(RecordId.of(1), "hash2").commandName());
        assertEquals("DEACTIVATE_RECORD", new DeactivateRecord(RecordId.of(1)).commandName());
        assertEquals("TRANSFER_OWNERSHIP", new TransferOwnership(CALLER).commandName());
    }
}
