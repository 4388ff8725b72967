package com.ryuqq.registry.core.error;

/**
 * 레지스트리 명령의 사전 조건 위반.
 *
 * <p>명령 전체가 중단되며 상태 변경은 없습니다. 재시도 정책은 호출자의 책임입니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class RegistryException extends RuntimeException {

    private final RegistryErrorCode errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 null인 경우
     */
    public RegistryException(RegistryErrorCode errorCode, String message) {
        super(message);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public RegistryErrorCode getErrorCode() {
        return errorCode;
    }

    public static RegistryException unauthorized(String message) {
        return new RegistryException(RegistryErrorCode.UNAUTHORIZED, message);
    }

    public static RegistryException forbidden(String message) {
        return new RegistryException(RegistryErrorCode.FORBIDDEN, message);
    }

    public static RegistryException invalidArgument(String message) {
        return new RegistryException(RegistryErrorCode.INVALID_ARGUMENT, message);
    }

    public static RegistryException alreadyAuthorized(String message) {
        return new RegistryException(RegistryErrorCode.ALREADY_AUTHORIZED, message);
    }

    public static RegistryException notAuthorized(String message) {
        return new RegistryException(RegistryErrorCode.NOT_AUTHORIZED, message);
    }

    public static RegistryException notFound(String message) {
        return new RegistryException(RegistryErrorCode.NOT_FOUND, message);
    }

    public static RegistryException inactive(String message) {
        return new RegistryException(RegistryErrorCode.INACTIVE, message);
    }

    @Override
    public String toString() {
        return "RegistryException{" + errorCode + ": " + getMessage() + '}';
    }
}
