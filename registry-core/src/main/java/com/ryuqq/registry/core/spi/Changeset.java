package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.entity.Contributor;
import com.ryuqq.registry.core.entity.SpeciesRecord;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;

import java.util.ArrayList;
import java.util.List;

/**
 * 하나의 명령이 만들어내는 쓰기 집합.
 *
 * <p>{@link RegistryStore#commit(Changeset)}는 Changeset 전체를 적용하거나
 * 아무것도 적용하지 않아야 합니다 (all-or-nothing).</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li><strong>owner:</strong> 새 Owner (변경 없으면 null)</li>
 *   <li><strong>contributors:</strong> upsert할 Contributor 목록</li>
 *   <li><strong>records:</strong> upsert할 레코드 목록 (신규 또는 갱신)</li>
 *   <li><strong>indexEntries:</strong> 생성자별 인덱스에 추가할 항목</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Changeset changeset = Changeset.builder()
 *     .putRecord(record)
 *     .appendToIndex(record.creator(), record.id())
 *     .build();
 * store.commit(changeset);
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class Changeset {

    private final Identity owner;
    private final List<Contributor> contributors;
    private final List<SpeciesRecord> records;
    private final List<IndexEntry> indexEntries;

    private Changeset(Builder builder) {
        this.owner = builder.owner;
        this.contributors = List.copyOf(builder.contributors);
        this.records = List.copyOf(builder.records);
        this.indexEntries = List.copyOf(builder.indexEntries);
    }

    /**
     * Builder 생성.
     *
     * @return 빈 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 새 Owner 조회.
     *
     * @return 새 Owner, 변경 없으면 null
     */
    public Identity getOwner() {
        return owner;
    }

    public List<Contributor> getContributors() {
        return contributors;
    }

    public List<SpeciesRecord> getRecords() {
        return records;
    }

    public List<IndexEntry> getIndexEntries() {
        return indexEntries;
    }

    /**
     * 적용할 변경이 없는지 확인.
     *
     * @return 비어 있으면 true
     */
    public boolean isEmpty() {
        return owner == null && contributors.isEmpty() && records.isEmpty() && indexEntries.isEmpty();
    }

    @Override
    public String toString() {
        return "Changeset{owner=" + owner
            + ", contributors=" + contributors.size()
            + ", records=" + records.size()
            + ", indexEntries=" + indexEntries.size() + '}';
    }

    /**
     * 생성자별 인덱스 추가 항목.
     *
     * @param creator 생성자
     * @param recordId 레코드 ID
     */
    public record IndexEntry(Identity creator, RecordId recordId) {

        public IndexEntry {
            if (creator == null) {
                throw new IllegalArgumentException("creator cannot be null");
            }
            if (recordId == null || recordId.isZero()) {
                throw new IllegalArgumentException("recordId cannot be null or zero");
            }
        }
    }

    /**
     * Changeset Builder.
     */
    public static final class Builder {

        private Identity owner;
        private final List<Contributor> contributors = new ArrayList<>();
        private final List<SpeciesRecord> records = new ArrayList<>();
        private final List<IndexEntry> indexEntries = new ArrayList<>();

        private Builder() {
        }

        public Builder owner(Identity owner) {
            if (Identity.isNullOrZero(owner)) {
                throw new IllegalArgumentException("owner cannot be null or zero");
            }
            this.owner = owner;
            return this;
        }

        public Builder putContributor(Contributor contributor) {
            if (contributor == null) {
                throw new IllegalArgumentException("contributor cannot be null");
            }
            contributors.add(contributor);
            return this;
        }

        public Builder putRecord(SpeciesRecord record) {
            if (record == null) {
                throw new IllegalArgumentException("record cannot be null");
            }
            records.add(record);
            return this;
        }

        public Builder appendToIndex(Identity creator, RecordId recordId) {
            indexEntries.add(new IndexEntry(creator, recordId));
            return this;
        }

        public Changeset build() {
            return new Changeset(this);
        }
    }
}
