package com.ryuqq.registry.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.registry.core.statemachine.RecordState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RecordTransition 테스트.
 *
 * <ul>
 *   <li>NONEXISTENT → ACTIVE → INACTIVE 정상 전이</li>
 *   <li>INACTIVE에서의 모든 전이는 IllegalStateException</li>
 *   <li>단계 건너뛰기/역전이는 IllegalStateException</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
class RecordTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_NormalFlow_EndsInactive() {
        // Given
        RecordState state = NONEXISTENT;

        // When
        state = RecordTransition.transition(state, ACTIVE);
        state = RecordTransition.transition(state, INACTIVE);

        // Then
        assertEquals(INACTIVE, state);
        assertTrue(state.isTerminal());
    }

    // ========== 금지된 전이 테스트 ==========

    @Test
    void validate_InactiveToActive_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> RecordTransition.validate(INACTIVE, ACTIVE)
        );
        assertTrue(exception.getMessage().contains("Cannot transition from terminal state"));
    }

    @Test
    void validate_InactiveToInactive_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> RecordTransition.validate(INACTIVE, INACTIVE));
    }

    @Test
    void validate_NonexistentToInactive_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> RecordTransition.validate(NONEXISTENT, INACTIVE)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_ActiveToNonexistent_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> RecordTransition.validate(ACTIVE, NONEXISTENT));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> RecordTransition.validate(null, ACTIVE));
        assertThrows(IllegalArgumentException.class, () -> RecordTransition.validate(ACTIVE, null));
    }

    // ========== 변경 가능 여부 ==========

    @Test
    void requireMutable_OnlyActivePasses() {
        assertDoesNotThrow(() -> RecordTransition.requireMutable(ACTIVE));
        assertThrows(IllegalStateException.class, () -> RecordTransition.requireMutable(INACTIVE));
        assertThrows(IllegalStateException.class, () -> RecordTransition.requireMutable(NONEXISTENT));
    }
}
