package com.ryuqq.registry.core.outcome;

/**
 * 명령 실행 결과.
 *
 * <ul>
 *   <li>{@link Ok}: 명령이 적용됨</li>
 *   <li>{@link Fail}: 사전 조건 위반으로 거부됨 (상태 변경 없음, 재시도 불가)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
