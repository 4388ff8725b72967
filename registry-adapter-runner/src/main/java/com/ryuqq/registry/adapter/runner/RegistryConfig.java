package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.core.model.Identity;

/**
 * 레지스트리 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>owner: 저장소가 비어 있을 때 설정되는 최초 Owner</li>
 *   <li>ownershipTransferable: Owner 이전 허용 여부 (기본 true)</li>
 * </ul>
 *
 * <p>저장소에 이미 Owner가 있으면 저장소의 값이 우선합니다 (Owner는 생성 시 한 번만 설정).</p>
 *
 * @author Registry Team
 * @since 1.0.0
 * @param owner 최초 Owner (null 또는 Zero Identity 불가)
 * @param ownershipTransferable Owner 이전 허용 여부
 */
public record RegistryConfig(Identity owner, boolean ownershipTransferable) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException owner가 null이거나 Zero Identity인 경우
     */
    public RegistryConfig {
        if (Identity.isNullOrZero(owner)) {
            throw new IllegalArgumentException("owner cannot be null or zero (current: " + owner + ")");
        }
    }

    /**
     * 기본 설정 (Owner 이전 허용).
     *
     * @param owner 최초 Owner
     * @return RegistryConfig
     */
    public static RegistryConfig of(Identity owner) {
        return new RegistryConfig(owner, true);
    }

    /**
     * owner만 변경한 새 인스턴스 생성.
     *
     * @param owner 새 최초 Owner
     * @return 새 RegistryConfig 인스턴스
     */
    public RegistryConfig withOwner(Identity owner) {
        return new RegistryConfig(owner, this.ownershipTransferable);
    }

    /**
     * ownershipTransferable만 변경한 새 인스턴스 생성.
     *
     * @param ownershipTransferable Owner 이전 허용 여부
     * @return 새 RegistryConfig 인스턴스
     */
    public RegistryConfig withOwnershipTransferable(boolean ownershipTransferable) {
        return new RegistryConfig(this.owner, ownershipTransferable);
    }
}
