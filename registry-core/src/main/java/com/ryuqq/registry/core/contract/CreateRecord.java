package com.ryuqq.registry.core.contract;

/**
 * 종 레코드 생성 명령.
 *
 * @param scientificName 학명
 * @param habitat 서식지
 * @param dataHash 외부 상세 데이터의 content hash
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record CreateRecord(String scientificName, String habitat, String dataHash) implements RegistryCommand {

    @Override
    public String commandName() {
        return "CREATE_RECORD";
    }
}
