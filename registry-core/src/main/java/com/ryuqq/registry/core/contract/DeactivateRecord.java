package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.RecordId;

/**
 * 레코드 비활성화 명령.
 *
 * @param recordId 대상 레코드
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record DeactivateRecord(RecordId recordId) implements RegistryCommand {

    @Override
    public String commandName() {
        return "DEACTIVATE_RECORD";
    }
}
