package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.core.model.Identity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RegistryConfig 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class RegistryConfigTest {

    private static final Identity OWNER = Identity.of("0xOWNER");

    @Test
    void of_DefaultsToTransferable() {
        RegistryConfig config = RegistryConfig.of(OWNER);

        assertEquals(OWNER, config.owner());
        assertTrue(config.ownershipTransferable());
    }

    @Test
    void withMethods_ReturnNewInstances() {
        // Given
        RegistryConfig config = RegistryConfig.of(OWNER);
        Identity other = Identity.of("0xOTHER");

        // When
        RegistryConfig locked = config.withOwnershipTransferable(false);
        RegistryConfig moved = config.withOwner(other);

        // Then
        assertFalse(locked.ownershipTransferable());
        assertEquals(OWNER, locked.owner());
        assertEquals(other, moved.owner());
        assertTrue(moved.ownershipTransferable());
        assertTrue(config.ownershipTransferable(), "Original must be unchanged");
    }

    @Test
    void constructor_NullOrZeroOwner_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RegistryConfig.of(null));
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> new RegistryConfig(Identity.ZERO, true));
        assertTrue(exception.getMessage().contains("owner cannot be null or zero"));
    }
}
