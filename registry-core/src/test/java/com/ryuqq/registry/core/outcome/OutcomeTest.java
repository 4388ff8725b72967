package com.ryuqq.registry.core.outcome;

import com.ryuqq.registry.core.error.RegistryErrorCode;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.RecordId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome (Ok / Fail) 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class OutcomeTest {

    // ========== Ok ==========

    @Test
    void ok_Of_NoRecordId() {
        Ok ok = Ok.of("GRANT_CONTRIBUTOR");

        assertTrue(ok.isOk());
        assertFalse(ok.isFail());
        assertNull(ok.recordId());
    }

    @Test
    void ok_Created_RequiresRecordId() {
        assertEquals(RecordId.of(3), Ok.created("CREATE_RECORD", RecordId.of(3)).recordId());
        assertThrows(IllegalArgumentException.class, () -> Ok.created("CREATE_RECORD", null));
    }

    @Test
    void ok_BlankCommandName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Ok.of(" "));
    }

    // ========== Fail ==========

    @Test
    void fail_From_CopiesCodeAndMessage() {
        // Given
        RegistryException exception = RegistryException.forbidden("not the creator");

        // When
        Fail fail = Fail.from(exception);

        // Then
        assertTrue(fail.isFail());
        assertEquals(RegistryErrorCode.FORBIDDEN, fail.errorCode());
        assertEquals("not the creator", fail.message());
    }

    @Test
    void fail_From_BlankMessage_FallsBackToCodeName() {
        Fail fail = Fail.from(new RegistryException(RegistryErrorCode.INACTIVE, ""));

        assertEquals("INACTIVE", fail.message());
    }

    @Test
    void fail_NullCode_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(null, "message"));
        assertThrows(IllegalArgumentException.class, () -> Fail.from(null));
    }
}
