package com.ryuqq.registry.core.statemachine;

/**
 * 레코드 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>NONEXISTENT → ACTIVE</li>
 *   <li>ACTIVE → INACTIVE</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(INACTIVE)에서는 어떤 상태로도 전이 불가</li>
 *   <li>어떤 상태에서도 NONEXISTENT로 돌아갈 수 없음</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class RecordTransition {

    // Utility class - prevent instantiation
    private RecordTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RecordState from, RecordState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case NONEXISTENT -> to == RecordState.ACTIVE;
            case ACTIVE -> to == RecordState.INACTIVE;
            case INACTIVE -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RecordState transition(RecordState current, RecordState next) {
        validate(current, next);
        return next;
    }

    /**
     * 내용 변경 가능 여부 검증.
     *
     * <p>상태 전이 없이 dataHash와 timestamp만 변경하는 경우에 사용합니다.</p>
     *
     * @param current 현재 상태
     * @throws IllegalArgumentException current가 null인 경우
     * @throws IllegalStateException ACTIVE가 아닌 경우
     */
    public static void requireMutable(RecordState current) {
        if (current == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        if (!current.isMutable()) {
            throw new IllegalStateException("Record is not mutable in state: " + current);
        }
    }
}
