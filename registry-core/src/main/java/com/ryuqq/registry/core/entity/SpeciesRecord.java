package com.ryuqq.registry.core.entity;

import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.statemachine.RecordState;
import com.ryuqq.registry.core.statemachine.RecordTransition;

/**
 * 종 관찰 레코드 (species entry).
 *
 * <p>상세 데이터는 외부 content-addressed 저장소에 있고, 레코드는 그 해시(dataHash)만 참조합니다.</p>
 *
 * <p><strong>불변 필드:</strong> id, scientificName, habitat, creator</p>
 * <p><strong>가변 필드 (ACTIVE 상태에서만):</strong> dataHash, timestamp</p>
 * <p><strong>상태:</strong> ACTIVE → INACTIVE (종료, 재활성화 불가)</p>
 *
 * <p>레코드는 불변 객체이며, 변경은 항상 새 인스턴스를 반환합니다.</p>
 *
 * @param id 레코드 식별자 (1 이상)
 * @param scientificName 학명
 * @param habitat 서식지
 * @param dataHash 외부 상세 데이터의 content hash
 * @param creator 생성자 Identity
 * @param timestamp 생성 또는 최종 수정 시각 (epoch millis)
 * @param state 레코드 상태 (ACTIVE 또는 INACTIVE)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record SpeciesRecord(
    RecordId id,
    String scientificName,
    String habitat,
    String dataHash,
    Identity creator,
    long timestamp,
    RecordState state
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null/blank이거나 id가 0인 경우
     */
    public SpeciesRecord {
        if (id == null || id.isZero()) {
            throw new IllegalArgumentException("id cannot be null or zero");
        }
        if (scientificName == null || scientificName.isBlank()) {
            throw new IllegalArgumentException("scientificName cannot be null or blank");
        }
        if (habitat == null || habitat.isBlank()) {
            throw new IllegalArgumentException("habitat cannot be null or blank");
        }
        if (dataHash == null || dataHash.isBlank()) {
            throw new IllegalArgumentException("dataHash cannot be null or blank");
        }
        if (Identity.isNullOrZero(creator)) {
            throw new IllegalArgumentException("creator cannot be null or zero");
        }
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be non-negative (current: " + timestamp + ")");
        }
        if (state == null || state == RecordState.NONEXISTENT) {
            throw new IllegalArgumentException("state must be ACTIVE or INACTIVE, but was: " + state);
        }
    }

    /**
     * 신규 ACTIVE 레코드 생성.
     *
     * @param id 할당된 식별자
     * @param scientificName 학명
     * @param habitat 서식지
     * @param dataHash content hash
     * @param creator 생성자
     * @param timestamp 생성 시각 (epoch millis)
     * @return ACTIVE 상태의 레코드
     */
    public static SpeciesRecord create(
        RecordId id,
        String scientificName,
        String habitat,
        String dataHash,
        Identity creator,
        long timestamp
    ) {
        RecordState state = RecordTransition.transition(RecordState.NONEXISTENT, RecordState.ACTIVE);
        return new SpeciesRecord(id, scientificName, habitat, dataHash, creator, timestamp, state);
    }

    /**
     * 활성 상태 여부.
     *
     * @return ACTIVE인 경우 true
     */
    public boolean isActive() {
        return state == RecordState.ACTIVE;
    }

    /**
     * dataHash를 교체하고 timestamp를 갱신한 사본 생성.
     *
     * @param newDataHash 새 content hash
     * @param modifiedAt 수정 시각 (epoch millis)
     * @return 변경된 레코드
     * @throws IllegalStateException INACTIVE 레코드인 경우
     */
    public SpeciesRecord withDataHash(String newDataHash, long modifiedAt) {
        RecordTransition.requireMutable(state);
        return new SpeciesRecord(id, scientificName, habitat, newDataHash, creator, modifiedAt, state);
    }

    /**
     * 비활성화된 사본 생성 (timestamp 유지).
     *
     * @return INACTIVE 상태의 레코드
     * @throws IllegalStateException 이미 INACTIVE인 경우
     */
    public SpeciesRecord deactivate() {
        RecordState next = RecordTransition.transition(state, RecordState.INACTIVE);
        return new SpeciesRecord(id, scientificName, habitat, dataHash, creator, timestamp, next);
    }

    /**
     * 불변 필드(id, scientificName, habitat, creator)가 동일한지 확인.
     *
     * @param other 비교 대상
     * @return 불변 필드가 모두 같으면 true
     */
    public boolean hasSameIdentityAs(SpeciesRecord other) {
        return other != null
            && id.equals(other.id)
            && scientificName.equals(other.scientificName)
            && habitat.equals(other.habitat)
            && creator.equals(other.creator);
    }
}
