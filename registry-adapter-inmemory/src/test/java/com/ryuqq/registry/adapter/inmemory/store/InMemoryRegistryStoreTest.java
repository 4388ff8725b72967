package com.ryuqq.registry.adapter.inmemory.store;

import com.ryuqq.registry.core.entity.Contributor;
import com.ryuqq.registry.core.entity.SpeciesRecord;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.spi.Changeset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryRegistryStore 유닛 테스트.
 *
 * <p>Changeset 불변식 검증은 AtomicityContract에서 다루고,
 * 여기서는 어댑터 고유 동작(초기 상태, 인자 검증, clear)을 검증합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
class InMemoryRegistryStoreTest {

    private static final Identity OWNER = Identity.of("0xOWNER");
    private static final Identity ALICE = Identity.of("0xALICE");

    private InMemoryRegistryStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegistryStore();
    }

    private void commitRecords(int count) {
        Changeset.Builder builder = Changeset.builder();
        for (int i = 1; i <= count; i++) {
            builder.putRecord(SpeciesRecord.create(RecordId.of(i), "Species " + i, "wetlands", "hash" + i, ALICE, i))
                .appendToIndex(ALICE, RecordId.of(i));
        }
        store.commit(builder.build());
    }

    @Test
    void 초기_상태는_Owner_없음_레코드_없음() {
        assertThat(store.getOwner()).isNull();
        assertThat(store.lastRecordId()).isEqualTo(RecordId.ZERO);
        assertThat(store.findContributor(ALICE)).isNull();
        assertThat(store.findRecord(RecordId.of(1))).isNull();
        assertThat(store.findRecordIdsByCreator(ALICE)).isEmpty();
        assertThat(store.listRecords(RecordId.of(1), 10)).isEmpty();
    }

    @Test
    void commit_Owner만_변경() {
        // when
        store.commit(Changeset.builder().owner(OWNER).build());

        // then
        assertThat(store.getOwner()).isEqualTo(OWNER);
        assertThat(store.lastRecordId()).isEqualTo(RecordId.ZERO);
    }

    @Test
    void listRecords_시작_ID부터_limit개_오름차순() {
        // given
        commitRecords(5);

        // when & then
        assertThat(store.listRecords(RecordId.of(2), 3))
            .extracting(SpeciesRecord::id)
            .containsExactly(RecordId.of(2), RecordId.of(3), RecordId.of(4));
        assertThat(store.listRecords(RecordId.of(5), 10)).hasSize(1);
    }

    @Test
    void 조회_null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> store.findContributor(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.findRecord(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.findRecordIdsByCreator(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.listRecords(RecordId.of(1), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("limit must be positive");
        assertThatThrownBy(() -> store.commit(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void commit_같은_Changeset_내_중복_인덱스는_거부() {
        // given
        SpeciesRecord record = SpeciesRecord.create(RecordId.of(1), "Rana temporaria", "wetlands", "hash1", ALICE, 0L);
        Changeset duplicated = Changeset.builder()
            .putRecord(record)
            .appendToIndex(ALICE, record.id())
            .appendToIndex(ALICE, record.id())
            .build();

        // when & then
        assertThatThrownBy(() -> store.commit(duplicated))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already indexed");
        assertThat(store.findRecord(record.id())).isNull();
    }

    @Test
    void clear_모든_상태_초기화() {
        // given
        store.commit(Changeset.builder()
            .owner(OWNER)
            .putContributor(Contributor.authorized(ALICE, "Lab A"))
            .build());
        commitRecords(2);

        // when
        store.clear();

        // then
        assertThat(store.getOwner()).isNull();
        assertThat(store.findContributor(ALICE)).isNull();
        assertThat(store.lastRecordId()).isEqualTo(RecordId.ZERO);
        assertThat(store.findRecordIdsByCreator(ALICE)).isEmpty();
    }
}
