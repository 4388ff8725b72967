package com.ryuqq.registry.core.entity;

import com.ryuqq.registry.core.model.Identity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contributor 엔티티 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class ContributorTest {

    private static final Identity ALICE = Identity.of("0xALICE");

    @Test
    void unknown_EmptyNameUnauthorized() {
        Contributor contributor = Contributor.unknown(ALICE);

        assertEquals(ALICE, contributor.identity());
        assertEquals("", contributor.name());
        assertFalse(contributor.authorized());
    }

    @Test
    void revoke_KeepsName() {
        // Given
        Contributor granted = Contributor.authorized(ALICE, "Lab A");

        // When
        Contributor revoked = granted.revoke();

        // Then
        assertEquals("Lab A", revoked.name());
        assertFalse(revoked.authorized());
        assertTrue(granted.authorized(), "Original must be unchanged");
    }

    @Test
    void constructor_NullFields_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Contributor(null, "Lab A", true));
        assertThrows(IllegalArgumentException.class, () -> new Contributor(ALICE, null, true));
    }
}
