package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.Identity;

/**
 * Contributor 승인 이벤트.
 *
 * @param identity 승인된 Identity
 * @param name 표시 이름
 * @param occurredAt 커밋 시각 (epoch millis)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record ContributorAuthorized(Identity identity, String name, long occurredAt) implements RegistryEvent {
}
