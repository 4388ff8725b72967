package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.Identity;

/**
 * Contributor 승인 명령.
 *
 * @param identity 승인할 Identity
 * @param name 표시 이름
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record GrantContributor(Identity identity, String name) implements RegistryCommand {

    @Override
    public String commandName() {
        return "GRANT_CONTRIBUTOR";
    }
}
