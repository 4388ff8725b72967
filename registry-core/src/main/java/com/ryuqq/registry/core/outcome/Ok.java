package com.ryuqq.registry.core.outcome;

import com.ryuqq.registry.core.model.RecordId;

/**
 * 성공 결과.
 *
 * @param commandName 적용된 명령 이름
 * @param recordId 생성된 레코드 ID (CREATE_RECORD인 경우만, 그 외 null)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Ok(
    String commandName,
    RecordId recordId
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException commandName이 null이거나 빈 문자열인 경우
     */
    public Ok {
        if (commandName == null || commandName.isBlank()) {
            throw new IllegalArgumentException("commandName cannot be null or blank");
        }
        // recordId는 null 허용
    }

    /**
     * 반환값 없는 명령의 성공 결과.
     *
     * @param commandName 명령 이름
     * @return Ok 인스턴스
     */
    public static Ok of(String commandName) {
        return new Ok(commandName, null);
    }

    /**
     * 레코드 생성 성공 결과.
     *
     * @param commandName 명령 이름
     * @param recordId 생성된 레코드 ID
     * @return Ok 인스턴스
     */
    public static Ok created(String commandName, RecordId recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null for created outcome");
        }
        return new Ok(commandName, recordId);
    }
}
