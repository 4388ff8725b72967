package com.ryuqq.registry.core.event;

/**
 * 레지스트리 상태 변경 알림.
 *
 * <p>커밋된 명령마다 정확히 하나의 이벤트가 커밋 순서대로 발행됩니다.
 * 거부된 명령은 이벤트를 발행하지 않습니다. 외부 구독자(인덱서, UI)는 이 스트림을
 * 감사 로그로 사용하며, 레지스트리 자체는 현재 상태 외의 이력을 보관하지 않습니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface RegistryEvent
    permits ContributorAuthorized, ContributorRevoked, RecordCreated, RecordUpdated, RecordDeactivated,
            OwnershipTransferred {

    /**
     * 이벤트 유형 이름.
     *
     * @return 이벤트 유형 (예: RecordCreated)
     */
    default String eventType() {
        return getClass().getSimpleName();
    }

    /**
     * 커밋 시각.
     *
     * @return epoch millis
     */
    long occurredAt();
}
