package com.ryuqq.registry.core.statemachine;

/**
 * 종 레코드의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>NONEXISTENT → ACTIVE (생성)</li>
 *   <li>ACTIVE → INACTIVE (비활성화)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NONEXISTENT
 *    │
 *    ▼ (createRecord)
 * ACTIVE ──┐
 *    │     │ (updateRecord: 상태 유지, dataHash/timestamp만 변경)
 *    │ ◄───┘
 *    ▼ (deactivateRecord)
 * INACTIVE
 *
 * 금지된 전이:
 * - INACTIVE → ACTIVE ❌
 * - INACTIVE → NONEXISTENT ❌
 * - ACTIVE → NONEXISTENT ❌ (물리 삭제 없음)
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum RecordState {

    /**
     * 아직 생성되지 않음 (id 미할당).
     */
    NONEXISTENT,

    /**
     * 활성 (dataHash 수정 가능).
     */
    ACTIVE,

    /**
     * 비활성 (영구, 조회만 가능).
     */
    INACTIVE;

    /**
     * 종료 상태인지 확인.
     *
     * @return INACTIVE인 경우 true
     */
    public boolean isTerminal() {
        return this == INACTIVE;
    }

    /**
     * 내용 변경(dataHash 갱신, 비활성화)이 가능한 상태인지 확인.
     *
     * @return ACTIVE인 경우 true
     */
    public boolean isMutable() {
        return this == ACTIVE;
    }
}
