package com.ryuqq.registry.core.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RegistryException / RegistryErrorCode 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class RegistryExceptionTest {

    @Test
    void factories_CarryMatchingCode() {
        assertEquals(RegistryErrorCode.UNAUTHORIZED, RegistryException.unauthorized("m").getErrorCode());
        assertEquals(RegistryErrorCode.FORBIDDEN, RegistryException.forbidden("m").getErrorCode());
        assertEquals(RegistryErrorCode.INVALID_ARGUMENT, RegistryException.invalidArgument("m").getErrorCode());
        assertEquals(RegistryErrorCode.ALREADY_AUTHORIZED, RegistryException.alreadyAuthorized("m").getErrorCode());
        assertEquals(RegistryErrorCode.NOT_AUTHORIZED, RegistryException.notAuthorized("m").getErrorCode());
        assertEquals(RegistryErrorCode.NOT_FOUND, RegistryException.notFound("m").getErrorCode());
        assertEquals(RegistryErrorCode.INACTIVE, RegistryException.inactive("m").getErrorCode());
    }

    @Test
    void errorCode_AbsentAndInactiveShareCategory() {
        assertEquals(RegistryErrorCode.Category.UNAVAILABLE, RegistryErrorCode.NOT_FOUND.getCategory());
        assertEquals(RegistryErrorCode.Category.UNAVAILABLE, RegistryErrorCode.INACTIVE.getCategory());
        assertEquals("REG-403", RegistryErrorCode.FORBIDDEN.getCode());
    }

    @Test
    void constructor_NullCode_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RegistryException(null, "m"));
    }

    @Test
    void toString_ContainsCodeAndMessage() {
        assertEquals("RegistryException{INACTIVE: record 3}", RegistryException.inactive("record 3").toString());
    }
}
