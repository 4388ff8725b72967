package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.Identity;

/**
 * Owner 이전 명령.
 *
 * @param newOwner 새 Owner
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record TransferOwnership(Identity newOwner) implements RegistryCommand {

    @Override
    public String commandName() {
        return "TRANSFER_OWNERSHIP";
    }
}
