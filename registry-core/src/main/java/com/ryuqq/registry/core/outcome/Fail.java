package com.ryuqq.registry.core.outcome;

import com.ryuqq.registry.core.error.RegistryErrorCode;
import com.ryuqq.registry.core.error.RegistryException;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>권한 없음 (UNAUTHORIZED, FORBIDDEN)</li>
 *   <li>유효성 검증 실패 (INVALID_ARGUMENT)</li>
 *   <li>중복 승인 / 미승인 해제 (ALREADY_AUTHORIZED, NOT_AUTHORIZED)</li>
 *   <li>대상 없음 또는 비활성 (NOT_FOUND, INACTIVE)</li>
 * </ul>
 *
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Fail(
    RegistryErrorCode errorCode,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode가 null이거나 message가 null/blank인 경우
     */
    public Fail {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(RegistryErrorCode errorCode, String message) {
        return new Fail(errorCode, message);
    }

    /**
     * RegistryException으로부터 Fail 생성.
     *
     * @param exception 레지스트리 예외
     * @return Fail 인스턴스
     */
    public static Fail from(RegistryException exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        String message = exception.getMessage();
        if (message == null || message.isBlank()) {
            message = exception.getErrorCode().name();
        }
        return new Fail(exception.getErrorCode(), message);
    }
}
