package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.RecordId;

/**
 * 레코드 비활성화 이벤트.
 *
 * @param recordId 레코드 ID
 * @param occurredAt 커밋 시각 (epoch millis)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record RecordDeactivated(RecordId recordId, long occurredAt) implements RegistryEvent {
}
