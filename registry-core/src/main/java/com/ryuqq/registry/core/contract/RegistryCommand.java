package com.ryuqq.registry.core.contract;

/**
 * 레지스트리 명령.
 *
 * <p>각 명령은 원자적으로 적용되거나 전부 실패합니다. 명령 자체는 입력값을 검증하지 않으며,
 * 빈 값 등의 검증은 레지스트리가 수행하여 {@code INVALID_ARGUMENT}로 거부합니다.</p>
 *
 * <p><strong>명령 목록:</strong></p>
 * <ul>
 *   <li>{@link GrantContributor} - Contributor 승인 (Owner 전용)</li>
 *   <li>{@link RevokeContributor} - Contributor 승인 해제 (Owner 전용)</li>
 *   <li>{@link CreateRecord} - 레코드 생성 (승인된 Contributor)</li>
 *   <li>{@link UpdateRecord} - dataHash 갱신 (생성자 전용)</li>
 *   <li>{@link DeactivateRecord} - 레코드 비활성화 (생성자 또는 Owner)</li>
 *   <li>{@link TransferOwnership} - Owner 이전 (Owner 전용)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface RegistryCommand
    permits GrantContributor, RevokeContributor, CreateRecord, UpdateRecord, DeactivateRecord, TransferOwnership {

    /**
     * 로그 및 결과 메시지에 쓰이는 명령 이름.
     *
     * @return 명령 이름 (예: CREATE_RECORD)
     */
    String commandName();
}
