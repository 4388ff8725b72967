package com.ryuqq.registry.core.entity;

import com.ryuqq.registry.core.model.Identity;

/**
 * 기여자(Contributor) 엔티티.
 *
 * <p>Identity당 하나의 항목만 존재하며, 삭제되지 않고 authorized 플래그만 변경됩니다.
 * 한 번도 승인되지 않은 Identity는 {@link #unknown(Identity)} (빈 이름, 미승인)으로 조회됩니다.</p>
 *
 * @param identity 기여자 Identity
 * @param name 표시 이름 (미등록 시 빈 문자열)
 * @param authorized 현재 승인 여부
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Contributor(
    Identity identity,
    String name,
    boolean authorized
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException identity 또는 name이 null인 경우
     */
    public Contributor {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }

    /**
     * 미등록 Identity의 zero-value.
     *
     * @param identity Identity
     * @return 빈 이름, 미승인 상태의 Contributor
     */
    public static Contributor unknown(Identity identity) {
        return new Contributor(identity, "", false);
    }

    /**
     * 승인된 Contributor 생성.
     *
     * @param identity Identity
     * @param name 표시 이름
     * @return 승인 상태의 Contributor
     */
    public static Contributor authorized(Identity identity, String name) {
        return new Contributor(identity, name, true);
    }

    /**
     * 승인 해제된 사본 생성 (이름 유지).
     *
     * @return authorized=false인 Contributor
     */
    public Contributor revoke() {
        return new Contributor(identity, name, false);
    }
}
