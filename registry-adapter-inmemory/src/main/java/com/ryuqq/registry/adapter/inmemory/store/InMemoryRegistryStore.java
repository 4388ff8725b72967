package com.ryuqq.registry.adapter.inmemory.store;

import com.ryuqq.registry.core.entity.Contributor;
import com.ryuqq.registry.core.entity.SpeciesRecord;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.spi.Changeset;
import com.ryuqq.registry.core.spi.RegistryStore;
import com.ryuqq.registry.core.statemachine.RecordState;
import com.ryuqq.registry.core.statemachine.RecordTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RegistryStore} SPI for testing and reference purposes.
 *
 * <p>Entities are never deleted. A commit replaces immutable {@link Contributor} and
 * {@link SpeciesRecord} values and swaps immutable index lists, so readers always
 * observe fully-built values without locking.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>contributors:</strong> ConcurrentHashMap&lt;Identity, Contributor&gt; - O(1) lookup</li>
 *   <li><strong>records:</strong> ConcurrentSkipListMap&lt;RecordId, SpeciesRecord&gt; - ordered by id for range listing</li>
 *   <li><strong>index:</strong> ConcurrentHashMap&lt;Identity, List&lt;RecordId&gt;&gt; - immutable lists, replaced on append</li>
 * </ul>
 *
 * <p><strong>Commit Semantics:</strong></p>
 * <ol>
 *   <li>Validate the whole changeset against the current state (nothing written yet)</li>
 *   <li>Apply owner, contributors, records, index entries</li>
 *   <li>Advance lastRecordId last, so a record is readable before it is counted</li>
 * </ol>
 *
 * <p><strong>Enforced Invariants:</strong></p>
 * <ul>
 *   <li>New record ids are strictly sequential from {@code lastRecordId + 1}</li>
 *   <li>New records are ACTIVE</li>
 *   <li>id, scientificName, habitat and creator never change</li>
 *   <li>INACTIVE records never change</li>
 *   <li>Index entries reference an existing record of the same creator, at most once</li>
 *   <li>The zero identity is never stored as contributor</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Concurrent commits are serialized by a monitor, not by a real transaction log</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RegistryStore store = new InMemoryRegistryStore();
 * Registry registry = new SerializedRegistry(store, new InMemoryEventBus(), RegistryConfig.of(owner));
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class InMemoryRegistryStore implements RegistryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRegistryStore.class);

    private final ConcurrentHashMap<Identity, Contributor> contributors;

    private final ConcurrentSkipListMap<RecordId, SpeciesRecord> records;

    /**
     * Contributor → record ids. Values are immutable lists swapped on append.
     */
    private final ConcurrentHashMap<Identity, List<RecordId>> index;

    private volatile Identity owner;

    private volatile RecordId lastRecordId;

    /**
     * Creates an empty store (no owner, no records).
     */
    public InMemoryRegistryStore() {
        this.contributors = new ConcurrentHashMap<>();
        this.records = new ConcurrentSkipListMap<>();
        this.index = new ConcurrentHashMap<>();
        this.lastRecordId = RecordId.ZERO;
    }

    @Override
    public Identity getOwner() {
        return owner;
    }

    @Override
    public Contributor findContributor(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        return contributors.get(identity);
    }

    @Override
    public SpeciesRecord findRecord(RecordId recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        return records.get(recordId);
    }

    @Override
    public RecordId lastRecordId() {
        return lastRecordId;
    }

    @Override
    public List<RecordId> findRecordIdsByCreator(Identity creator) {
        if (creator == null) {
            throw new IllegalArgumentException("creator cannot be null");
        }
        return index.getOrDefault(creator, List.of());
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> O(log N + limit) using the skip list tail view.</p>
     */
    @Override
    public List<SpeciesRecord> listRecords(RecordId fromInclusive, int limit) {
        if (fromInclusive == null) {
            throw new IllegalArgumentException("fromInclusive cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        return records.tailMap(fromInclusive, true).values().stream()
            .limit(limit)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Synchronized: one commit at a time</li>
     *   <li>Validation runs against a staged view before any write</li>
     *   <li>Empty changesets are accepted as no-ops</li>
     * </ul>
     */
    @Override
    public synchronized void commit(Changeset changeset) {
        if (changeset == null) {
            throw new IllegalArgumentException("changeset cannot be null");
        }
        if (changeset.isEmpty()) {
            return;
        }

        RecordId newLastRecordId = validate(changeset);

        if (changeset.getOwner() != null) {
            owner = changeset.getOwner();
        }
        for (Contributor contributor : changeset.getContributors()) {
            contributors.put(contributor.identity(), contributor);
        }
        for (SpeciesRecord record : changeset.getRecords()) {
            records.put(record.id(), record);
        }
        for (Changeset.IndexEntry entry : changeset.getIndexEntries()) {
            List<RecordId> current = index.getOrDefault(entry.creator(), List.of());
            List<RecordId> appended = new ArrayList<>(current.size() + 1);
            appended.addAll(current);
            appended.add(entry.recordId());
            index.put(entry.creator(), List.copyOf(appended));
        }
        lastRecordId = newLastRecordId;

        log.debug("Committed {} (lastRecordId={})", changeset, newLastRecordId);
    }

    /**
     * Checks every write of the changeset against the current state.
     *
     * @return lastRecordId after the changeset is applied
     * @throws IllegalStateException if any write violates a store invariant
     */
    private RecordId validate(Changeset changeset) {
        for (Contributor contributor : changeset.getContributors()) {
            if (contributor.identity().isZero()) {
                throw new IllegalStateException("Zero identity cannot be stored as contributor");
            }
        }

        Map<RecordId, SpeciesRecord> staged = new HashMap<>();
        RecordId nextLast = lastRecordId;
        for (SpeciesRecord record : changeset.getRecords()) {
            SpeciesRecord current = staged.containsKey(record.id()) ? staged.get(record.id()) : records.get(record.id());
            if (current == null) {
                if (!record.id().equals(nextLast.next())) {
                    throw new IllegalStateException(
                        "Record id must be sequential: expected " + nextLast.next() + ", but was " + record.id());
                }
                if (record.state() != RecordState.ACTIVE) {
                    throw new IllegalStateException("New record must be ACTIVE, but was: " + record.state());
                }
                nextLast = record.id();
            } else {
                validateReplacement(current, record);
            }
            staged.put(record.id(), record);
        }

        Map<Identity, List<RecordId>> stagedIndex = new HashMap<>();
        for (Changeset.IndexEntry entry : changeset.getIndexEntries()) {
            SpeciesRecord target = staged.containsKey(entry.recordId()) ? staged.get(entry.recordId()) : records.get(entry.recordId());
            if (target == null) {
                throw new IllegalStateException("Index entry references unknown record: " + entry.recordId());
            }
            if (!target.creator().equals(entry.creator())) {
                throw new IllegalStateException(
                    "Index entry creator " + entry.creator() + " does not match record creator " + target.creator());
            }
            List<RecordId> existing = stagedIndex.computeIfAbsent(
                entry.creator(), creator -> new ArrayList<>(index.getOrDefault(creator, List.of())));
            if (existing.contains(entry.recordId())) {
                throw new IllegalStateException("Record already indexed for " + entry.creator() + ": " + entry.recordId());
            }
            existing.add(entry.recordId());
        }
        return nextLast;
    }

    private void validateReplacement(SpeciesRecord current, SpeciesRecord replacement) {
        if (!current.hasSameIdentityAs(replacement)) {
            throw new IllegalStateException("Immutable fields of record " + current.id() + " cannot change");
        }
        if (current.state() == RecordState.INACTIVE) {
            if (!current.equals(replacement)) {
                throw new IllegalStateException("Inactive record cannot change: " + current.id());
            }
            return;
        }
        if (replacement.state() != current.state()) {
            RecordTransition.validate(current.state(), replacement.state());
        }
    }

    /**
     * Clears all stored data (testing utility).
     */
    public synchronized void clear() {
        contributors.clear();
        records.clear();
        index.clear();
        owner = null;
        lastRecordId = RecordId.ZERO;
    }
}
