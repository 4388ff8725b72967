package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.RecordId;

/**
 * 레코드 dataHash 갱신 이벤트.
 *
 * @param recordId 레코드 ID
 * @param newDataHash 새 content hash
 * @param occurredAt 커밋 시각 (epoch millis)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record RecordUpdated(RecordId recordId, String newDataHash, long occurredAt) implements RegistryEvent {
}
