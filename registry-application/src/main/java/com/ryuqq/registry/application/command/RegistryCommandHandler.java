package com.ryuqq.registry.application.command;

import com.ryuqq.registry.core.contract.Envelope;
import com.ryuqq.registry.core.outcome.Outcome;

/**
 * Envelope 기반 명령 진입점.
 *
 * <p>전송 계층(RPC, 메시지 큐 등)에서 받은 명령을 레지스트리에 적용하고,
 * 결과를 {@link Outcome}으로 반환합니다. 레지스트리 오류는 예외로 전파되지 않고
 * {@link com.ryuqq.registry.core.outcome.Fail}로 변환됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = handler.handle(Envelope.now(alice, new CreateRecord("Rana temporaria", "wetlands", "hash1")));
 * if (outcome instanceof Ok ok) {
 *     RecordId id = ok.recordId();
 * }
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface RegistryCommandHandler {

    /**
     * 명령 적용.
     *
     * @param envelope 호출자 + 명령
     * @return Ok 또는 Fail
     * @throws IllegalArgumentException envelope이 null인 경우
     */
    Outcome handle(Envelope envelope);
}
