package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.entity.Contributor;
import com.ryuqq.registry.core.entity.SpeciesRecord;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;

import java.util.List;

/**
 * 종 관찰 레지스트리.
 *
 * <p>Owner가 Contributor를 승인/해제하고, 승인된 Contributor가 레코드를 생성/수정하며,
 * 생성자 또는 Owner가 레코드를 비활성화합니다.</p>
 *
 * <p><strong>원자성:</strong> 모든 변경 명령은 전부 적용되거나 전부 실패합니다.
 * 실패 시 {@link com.ryuqq.registry.core.error.RegistryException}이 발생하며 상태 변경과
 * 이벤트 발행은 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * registry.grantContributor(owner, alice, "Lab A");
 * RecordId id = registry.createRecord(alice, "Rana temporaria", "wetlands", "hash1");
 * registry.updateRecord(alice, id, "hash2");
 * registry.deactivateRecord(owner, id);
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface Registry {

    // ========== Authorization ==========

    /**
     * Contributor 승인.
     *
     * <p>재승인(해제 후 다시 승인)은 허용되며, 이름은 새 값으로 갱신됩니다.</p>
     *
     * @param caller 호출자 (Owner여야 함)
     * @param identity 승인할 Identity
     * @param name 표시 이름
     * @throws com.ryuqq.registry.core.error.RegistryException
     *         UNAUTHORIZED (Owner 아님), INVALID_ARGUMENT (null/Zero Identity, 빈 이름),
     *         ALREADY_AUTHORIZED (이미 승인됨)
     */
    void grantContributor(Identity caller, Identity identity, String name);

    /**
     * Contributor 승인 해제 (이름 유지).
     *
     * @param caller 호출자 (Owner여야 함)
     * @param identity 해제할 Identity
     * @throws com.ryuqq.registry.core.error.RegistryException
     *         UNAUTHORIZED (Owner 아님), NOT_AUTHORIZED (현재 승인되지 않음)
     */
    void revokeContributor(Identity caller, Identity identity);

    /**
     * Contributor 조회.
     *
     * @param identity Identity
     * @return Contributor (미등록이면 빈 이름, 미승인)
     * @throws com.ryuqq.registry.core.error.RegistryException INVALID_ARGUMENT (identity가 null)
     */
    Contributor getContributor(Identity identity);

    /**
     * 현재 Owner.
     *
     * @return Owner Identity
     */
    Identity owner();

    /**
     * Owner 이전.
     *
     * @param caller 호출자 (Owner여야 함)
     * @param newOwner 새 Owner
     * @throws com.ryuqq.registry.core.error.RegistryException
     *         UNAUTHORIZED (Owner 아님), FORBIDDEN (설정으로 비활성화됨),
     *         INVALID_ARGUMENT (null/Zero Identity)
     */
    void transferOwnership(Identity caller, Identity newOwner);

    // ========== Record Lifecycle ==========

    /**
     * 레코드 생성.
     *
     * @param caller 호출자 (현재 승인된 Contributor여야 함)
     * @param scientificName 학명
     * @param habitat 서식지
     * @param dataHash content hash
     * @return 할당된 레코드 ID (1부터 순차)
     * @throws com.ryuqq.registry.core.error.RegistryException
     *         UNAUTHORIZED (승인되지 않음), INVALID_ARGUMENT (빈 문자열)
     */
    RecordId createRecord(Identity caller, String scientificName, String habitat, String dataHash);

    /**
     * 레코드 dataHash 갱신 (timestamp 갱신).
     *
     * @param caller 호출자 (생성자여야 함, Owner도 우회 불가)
     * @param recordId 레코드 ID
     * @param newDataHash 새 content hash
     * @throws com.ryuqq.registry.core.error.RegistryException
     *         INACTIVE (없음 또는 비활성), FORBIDDEN (생성자 아님), INVALID_ARGUMENT (빈 hash)
     */
    void updateRecord(Identity caller, RecordId recordId, String newDataHash);

    /**
     * 레코드 비활성화 (비가역).
     *
     * @param caller 호출자 (생성자 또는 Owner)
     * @param recordId 레코드 ID
     * @throws com.ryuqq.registry.core.error.RegistryException
     *         INACTIVE (없음 또는 이미 비활성), FORBIDDEN (생성자도 Owner도 아님)
     */
    void deactivateRecord(Identity caller, RecordId recordId);

    // ========== Queries ==========

    /**
     * 레코드 조회 (비활성 레코드 포함).
     *
     * @param recordId 레코드 ID
     * @return 레코드
     * @throws com.ryuqq.registry.core.error.RegistryException NOT_FOUND (0 또는 미할당)
     */
    SpeciesRecord getRecord(RecordId recordId);

    /**
     * 생성자별 레코드 ID 목록 (비활성 레코드 포함).
     *
     * @param identity 생성자
     * @return 불변 목록 (없으면 빈 목록)
     */
    List<RecordId> getContributorRecords(Identity identity);

    /**
     * ID 오름차순 레코드 목록 (비활성 포함).
     *
     * @param fromInclusive 시작 ID (0이면 1부터)
     * @param limit 최대 개수 (양수)
     * @return 레코드 목록
     * @throws com.ryuqq.registry.core.error.RegistryException INVALID_ARGUMENT (limit이 양수가 아님)
     */
    List<SpeciesRecord> listRecords(RecordId fromInclusive, int limit);

    /**
     * 지금까지 할당된 레코드 수.
     *
     * @return 마지막 레코드 ID 값
     */
    long recordCount();
}
