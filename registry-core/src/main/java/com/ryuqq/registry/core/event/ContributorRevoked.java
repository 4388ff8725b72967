package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.Identity;

/**
 * Contributor 승인 해제 이벤트.
 *
 * @param identity 승인 해제된 Identity
 * @param occurredAt 커밋 시각 (epoch millis)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record ContributorRevoked(Identity identity, long occurredAt) implements RegistryEvent {
}
