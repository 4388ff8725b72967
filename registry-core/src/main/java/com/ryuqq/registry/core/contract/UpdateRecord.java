package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.RecordId;

/**
 * 레코드 dataHash 갱신 명령.
 *
 * @param recordId 대상 레코드
 * @param newDataHash 새 content hash
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record UpdateRecord(RecordId recordId, String newDataHash) implements RegistryCommand {

    @Override
    public String commandName() {
        return "UPDATE_RECORD";
    }
}
