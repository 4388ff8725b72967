package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.Identity;

/**
 * Contributor 승인 해제 명령.
 *
 * @param identity 승인 해제할 Identity
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record RevokeContributor(Identity identity) implements RegistryCommand {

    @Override
    public String commandName() {
        return "REVOKE_CONTRIBUTOR";
    }
}
