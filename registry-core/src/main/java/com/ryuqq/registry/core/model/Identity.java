package com.ryuqq.registry.core.model;

import java.util.regex.Pattern;

/**
 * 레지스트리 호출자 및 기여자 식별자.
 *
 * <p>Identity는 명령을 발행하는 주체(Owner, Contributor, 일반 조회자)를 구분하며,
 * 원장(ledger) 계정 주소처럼 불투명한 문자열로 취급됩니다.</p>
 *
 * <p><strong>Zero Identity:</strong></p>
 * <ul>
 *   <li>{@link #ZERO}는 "식별자 없음"을 나타내는 예약값입니다</li>
 *   <li>Contributor로 승인될 수 없고, Owner가 될 수 없습니다</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자 포함 불가</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class Identity {

    private static final Pattern VALID_PATTERN = Pattern.compile("^\\S+$");

    /**
     * 예약된 Zero Identity 값.
     */
    public static final String ZERO_VALUE = "0x0000000000000000000000000000000000000000";

    /**
     * "식별자 없음"을 나타내는 Zero Identity.
     */
    public static final Identity ZERO = new Identity(ZERO_VALUE);

    private final String value;

    private Identity(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("Identity length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Identity cannot contain whitespace");
        }
        this.value = value;
    }

    /**
     * Identity 생성.
     *
     * @param value Identity 값
     * @return Identity 인스턴스 (ZERO_VALUE인 경우 {@link #ZERO})
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Identity of(String value) {
        if (ZERO_VALUE.equals(value)) {
            return ZERO;
        }
        return new Identity(value);
    }

    /**
     * Zero Identity 여부 확인.
     *
     * @return Zero Identity인 경우 true
     */
    public boolean isZero() {
        return ZERO_VALUE.equals(value);
    }

    /**
     * null 또는 Zero Identity 여부 확인.
     *
     * @param identity 검사할 Identity (null 가능)
     * @return null이거나 Zero Identity인 경우 true
     */
    public static boolean isNullOrZero(Identity identity) {
        return identity == null || identity.isZero();
    }

    /**
     * Identity 값 조회.
     *
     * @return Identity 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identity identity = (Identity) o;
        return value.equals(identity.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Identity{" + value + '}';
    }
}
