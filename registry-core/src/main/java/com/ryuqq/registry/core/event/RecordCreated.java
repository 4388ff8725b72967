package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;

/**
 * 레코드 생성 이벤트.
 *
 * @param recordId 할당된 레코드 ID
 * @param scientificName 학명
 * @param habitat 서식지
 * @param dataHash content hash
 * @param creator 생성자
 * @param occurredAt 커밋 시각 (epoch millis)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record RecordCreated(
    RecordId recordId,
    String scientificName,
    String habitat,
    String dataHash,
    Identity creator,
    long occurredAt
) implements RegistryEvent {
}
