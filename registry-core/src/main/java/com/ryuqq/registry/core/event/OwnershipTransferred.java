package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.Identity;

/**
 * Owner 이전 이벤트.
 *
 * @param previousOwner 이전 Owner
 * @param newOwner 새 Owner
 * @param occurredAt 커밋 시각 (epoch millis)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record OwnershipTransferred(Identity previousOwner, Identity newOwner, long occurredAt) implements RegistryEvent {
}
