package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.Identity;

/**
 * 명령 실행을 위한 봉투 (Envelope).
 *
 * <p>Envelope은 명령에 호출자 Identity와 수락 시각을 더한 실행 컨텍스트입니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>caller:</strong> 명령을 발행한 Identity</li>
 *   <li><strong>command:</strong> 실행할 명령</li>
 *   <li><strong>acceptedAt:</strong> 요청 수락 시각 (epoch milliseconds)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Envelope envelope = Envelope.now(
 *     Identity.of("alice"),
 *     new CreateRecord("Rana temporaria", "wetlands", "hash1")
 * );
 * </pre>
 *
 * @param caller 호출자 Identity
 * @param command 실행할 명령
 * @param acceptedAt 요청 수락 시각 (epoch millis)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Envelope(
    Identity caller,
    RegistryCommand command,
    long acceptedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 acceptedAt이 음수인 경우
     */
    public Envelope {
        if (caller == null) {
            throw new IllegalArgumentException("caller cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (acceptedAt < 0) {
            throw new IllegalArgumentException("acceptedAt must be non-negative (current: " + acceptedAt + ")");
        }
    }

    /**
     * Envelope 생성 (명시적 시각 지정).
     *
     * @param caller 호출자
     * @param command 명령
     * @param acceptedAt 요청 수락 시각 (epoch milliseconds)
     * @return 생성된 Envelope
     */
    public static Envelope of(Identity caller, RegistryCommand command, long acceptedAt) {
        return new Envelope(caller, command, acceptedAt);
    }

    /**
     * 현재 시각으로 Envelope 생성.
     *
     * @param caller 호출자
     * @param command 명령
     * @return 생성된 Envelope
     */
    public static Envelope now(Identity caller, RegistryCommand command) {
        return new Envelope(caller, command, System.currentTimeMillis());
    }
}
