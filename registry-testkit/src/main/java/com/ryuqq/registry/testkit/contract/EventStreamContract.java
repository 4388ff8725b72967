package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.error.RegistryErrorCode;
import com.ryuqq.registry.core.event.ContributorAuthorized;
import com.ryuqq.registry.core.event.ContributorRevoked;
import com.ryuqq.registry.core.event.RecordCreated;
import com.ryuqq.registry.core.event.RecordDeactivated;
import com.ryuqq.registry.core.event.RecordUpdated;
import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.model.RecordId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: notification stream.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Each committed command emits exactly one event carrying the commit time</li>
 *   <li>Events arrive in commit order</li>
 *   <li>Rejected commands emit nothing</li>
 *   <li>A failing listener affects neither the commit nor other listeners</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class EventStreamContract extends AbstractRegistryContractTest {

    @Test
    public void testEvents_FullLifecycle_EmittedInCommitOrder() {
        // When
        registry.grantContributor(OWNER, ALICE, "Lab A");
        clock.advance(Duration.ofSeconds(1));
        RecordId id = registry.createRecord(ALICE, "Rana temporaria", "wetlands", "hash1");
        clock.advance(Duration.ofSeconds(1));
        registry.updateRecord(ALICE, id, "hash2");
        clock.advance(Duration.ofSeconds(1));
        registry.deactivateRecord(OWNER, id);
        clock.advance(Duration.ofSeconds(1));
        registry.revokeContributor(OWNER, ALICE);

        // Then
        List<RegistryEvent> expected = List.of(
            new ContributorAuthorized(ALICE, "Lab A", START_MILLIS),
            new RecordCreated(id, "Rana temporaria", "wetlands", "hash1", ALICE, START_MILLIS + 1_000),
            new RecordUpdated(id, "hash2", START_MILLIS + 2_000),
            new RecordDeactivated(id, START_MILLIS + 3_000),
            new ContributorRevoked(ALICE, START_MILLIS + 4_000));
        assertEquals(expected, events.events());
    }

    @Test
    public void testEvents_RecordCreatedTimestampMatchesRecord() {
        // Given
        grant(ALICE, "Lab A");
        clock.advance(Duration.ofMillis(250));

        // When
        RecordId id = createRecordAs(ALICE, "Bufo bufo");

        // Then
        RecordCreated created = (RecordCreated) events.last();
        assertEquals(registry.getRecord(id).timestamp(), created.occurredAt());
        assertEquals("RecordCreated", created.eventType());
    }

    @Test
    public void testEvents_RejectedCommands_NothingEmitted() {
        // Given
        grant(ALICE, "Lab A");
        RecordId id = createRecordAs(ALICE, "Rana temporaria");
        int before = events.size();

        // When
        assertRejected(RegistryErrorCode.ALREADY_AUTHORIZED, () -> registry.grantContributor(OWNER, ALICE, "Lab A"));
        assertRejected(RegistryErrorCode.UNAUTHORIZED, () -> createRecordAs(BOB, "Bufo bufo"));
        assertRejected(RegistryErrorCode.FORBIDDEN, () -> registry.updateRecord(OWNER, id, "x"));
        assertRejected(RegistryErrorCode.NOT_AUTHORIZED, () -> registry.revokeContributor(OWNER, BOB));

        // Then
        assertEquals(before, events.size());
    }

    @Test
    public void testEvents_FailingListener_CommitAndOtherListenersUnaffected() {
        // Given: a throwing listener subscribed between two recording listeners
        RecordingEventListener late = new RecordingEventListener();
        eventBus.subscribe(event -> {
            throw new IllegalStateException("listener failure");
        });
        eventBus.subscribe(late);

        // When
        registry.grantContributor(OWNER, ALICE, "Lab A");

        // Then
        assertContributor(ALICE, "Lab A", true);
        assertEquals(1, events.size());
        assertEquals(1, late.size());
        assertEquals(events.events(), late.events());
    }

    @Test
    public void testEvents_Unsubscribed_NoLongerDelivered() {
        // Given
        RecordingEventListener extra = new RecordingEventListener();
        eventBus.subscribe(extra);
        grant(ALICE, "Lab A");

        // When
        assertTrue(eventBus.unsubscribe(extra));
        grant(BOB, "Lab B");

        // Then
        assertEquals(1, extra.size());
        assertEquals(2, events.size());
        assertFalse(eventBus.unsubscribe(extra));
    }
}
