package com.ryuqq.registry.core.error;

/**
 * 레지스트리 오류 코드.
 *
 * <p>모든 오류는 동기적이며 재시도 불가입니다. 오류 발생 시 상태 변경은 일어나지 않습니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>AUTHORIZATION: UNAUTHORIZED, FORBIDDEN</li>
 *   <li>VALIDATION: INVALID_ARGUMENT</li>
 *   <li>CONFLICT: ALREADY_AUTHORIZED, NOT_AUTHORIZED</li>
 *   <li>UNAVAILABLE: NOT_FOUND, INACTIVE (동일 클래스로 취급)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum RegistryErrorCode {

    /**
     * 호출자에게 필요한 권한이 없음 (Owner 아님, 승인된 Contributor 아님).
     */
    UNAUTHORIZED("REG-401", Category.AUTHORIZATION),

    /**
     * 대상 엔티티와의 관계가 없음 (생성자/Owner 아님) 또는 비활성화된 기능.
     */
    FORBIDDEN("REG-403", Category.AUTHORIZATION),

    /**
     * 빈 값, null, Zero Identity 입력.
     */
    INVALID_ARGUMENT("REG-400", Category.VALIDATION),

    /**
     * 이미 승인된 Identity에 대한 승인 요청.
     */
    ALREADY_AUTHORIZED("REG-409", Category.CONFLICT),

    /**
     * 승인되지 않은 Identity에 대한 승인 해제 요청.
     */
    NOT_AUTHORIZED("REG-412", Category.CONFLICT),

    /**
     * 레코드가 존재하지 않음 (조회).
     */
    NOT_FOUND("REG-404", Category.UNAVAILABLE),

    /**
     * 레코드가 존재하지 않거나 비활성 상태 (변경).
     */
    INACTIVE("REG-410", Category.UNAVAILABLE);

    /**
     * 오류 분류.
     */
    public enum Category {
        AUTHORIZATION,
        VALIDATION,
        CONFLICT,
        UNAVAILABLE
    }

    private final String code;
    private final Category category;

    RegistryErrorCode(String code, Category category) {
        this.code = code;
        this.category = category;
    }

    /**
     * 외부 노출용 오류 코드 (예: REG-403).
     *
     * @return 오류 코드 문자열
     */
    public String getCode() {
        return code;
    }

    /**
     * 오류 분류 조회.
     *
     * @return 분류
     */
    public Category getCategory() {
        return category;
    }
}
