package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.entity.Contributor;
import com.ryuqq.registry.core.entity.SpeciesRecord;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;

import java.util.List;

/**
 * 레지스트리 상태 저장소 SPI.
 *
 * <p>원장(ledger)과 같은 append-only 트랜잭션 저장소를 추상화합니다.
 * Contributor와 레코드는 삭제되지 않고, 상태 필드만 변경된 새 값으로 교체됩니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>{@link #commit(Changeset)}의 원자성: 전부 적용 또는 전부 거부</li>
 *   <li>레코드 불변식 보호: id/학명/서식지/생성자 변경 불가, INACTIVE 레코드 변경 불가</li>
 *   <li>신규 레코드 ID는 {@link #lastRecordId()} + 1 이어야 함 (순차, 재사용 불가)</li>
 *   <li>생성자별 인덱스는 append-only</li>
 *   <li>조회는 마지막으로 커밋된 상태를 잠금 없이 읽을 수 있어야 함</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <p>쓰기 직렬화는 레지스트리(단일 writer)가 담당합니다. 저장소는 commit 호출 간의
 * 원자성과 조회 스레드에 대한 가시성만 보장하면 됩니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface RegistryStore {

    /**
     * 현재 Owner 조회.
     *
     * @return 현재 Owner, 아직 초기화되지 않았으면 null
     */
    Identity getOwner();

    /**
     * Contributor 조회.
     *
     * @param identity Identity
     * @return Contributor (존재하는 경우), null (한 번도 승인되지 않은 경우)
     * @throws IllegalArgumentException identity가 null인 경우
     */
    Contributor findContributor(Identity identity);

    /**
     * 레코드 조회.
     *
     * @param recordId 레코드 ID
     * @return 레코드 (존재하는 경우), null (0이거나 미할당인 경우)
     * @throws IllegalArgumentException recordId가 null인 경우
     */
    SpeciesRecord findRecord(RecordId recordId);

    /**
     * 마지막으로 할당된 레코드 ID.
     *
     * @return 마지막 ID, 레코드가 없으면 {@link RecordId#ZERO}
     */
    RecordId lastRecordId();

    /**
     * 생성자별 레코드 ID 목록 (누적, 비활성 레코드 포함).
     *
     * @param creator 생성자
     * @return 불변 목록 (없으면 빈 목록)
     * @throws IllegalArgumentException creator가 null인 경우
     */
    List<RecordId> findRecordIdsByCreator(Identity creator);

    /**
     * ID 오름차순 레코드 목록.
     *
     * @param fromInclusive 시작 ID (포함)
     * @param limit 최대 개수
     * @return 레코드 목록 (비활성 포함, 없으면 빈 목록)
     * @throws IllegalArgumentException fromInclusive가 null이거나 limit이 양수가 아닌 경우
     */
    List<SpeciesRecord> listRecords(RecordId fromInclusive, int limit);

    /**
     * Changeset을 원자적으로 적용.
     *
     * @param changeset 적용할 변경
     * @throws IllegalArgumentException changeset이 null인 경우
     * @throws IllegalStateException 불변식을 위반하는 경우 (아무것도 적용되지 않음)
     */
    void commit(Changeset changeset);
}
