package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.registry.Registry;
import com.ryuqq.registry.core.entity.Contributor;
import com.ryuqq.registry.core.entity.SpeciesRecord;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.event.ContributorAuthorized;
import com.ryuqq.registry.core.event.ContributorRevoked;
import com.ryuqq.registry.core.event.OwnershipTransferred;
import com.ryuqq.registry.core.event.RecordCreated;
import com.ryuqq.registry.core.event.RecordDeactivated;
import com.ryuqq.registry.core.event.RecordUpdated;
import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.spi.Changeset;
import com.ryuqq.registry.core.spi.EventBus;
import com.ryuqq.registry.core.spi.RegistryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 단일 writer 레지스트리 구현체.
 *
 * <p>모든 변경 명령은 하나의 쓰기 잠금 뒤에서 직렬화되어, 원장의 전순서(total order)와
 * 동일한 효과를 냅니다. 조회는 잠금 없이 저장소의 마지막 커밋 상태를 읽습니다.</p>
 *
 * <p><strong>명령 처리 흐름:</strong></p>
 * <ol>
 *   <li>쓰기 잠금 획득</li>
 *   <li>모든 사전 조건 검증 (실패 시 RegistryException, 상태 변경 없음)</li>
 *   <li>Changeset 구성 후 {@link RegistryStore#commit(Changeset)} (원자적 적용)</li>
 *   <li>이벤트 발행 (잠금 보유 중 → 발행 순서 = 커밋 순서)</li>
 * </ol>
 *
 * <p><strong>이벤트 전달:</strong> 버스가 발행에 실패하면 이벤트는 버려지지 않고 대기열에 남아,
 * 다음 커밋의 이벤트보다 먼저 재전달됩니다.</p>
 *
 * <p><strong>ID 할당:</strong> 레코드 ID는 같은 잠금 안에서 {@code lastRecordId + 1}로 계산되므로,
 * 동시 호출에서도 유일하고 단조 증가합니다. 거부된 명령은 ID를 소비하지 않습니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class SerializedRegistry implements Registry {

    private static final Logger log = LoggerFactory.getLogger(SerializedRegistry.class);

    private final RegistryStore store;
    private final EventBus eventBus;
    private final RegistryConfig config;
    private final Clock clock;
    private final Object writeLock = new Object();
    private final Deque<RegistryEvent> undelivered = new ArrayDeque<>();

    /**
     * 생성자 (시스템 UTC 시계).
     *
     * @param store 상태 저장소
     * @param eventBus 이벤트 버스
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SerializedRegistry(RegistryStore store, EventBus eventBus, RegistryConfig config) {
        this(store, eventBus, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * <p>저장소에 Owner가 없으면 설정의 Owner로 초기화합니다.</p>
     *
     * @param store 상태 저장소
     * @param eventBus 이벤트 버스
     * @param config 설정
     * @param clock 레코드 timestamp 및 이벤트 시각에 쓰이는 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SerializedRegistry(RegistryStore store, EventBus eventBus, RegistryConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.eventBus = eventBus;
        this.config = config;
        this.clock = clock;
        initializeOwner();
    }

    private void initializeOwner() {
        synchronized (writeLock) {
            Identity current = store.getOwner();
            if (current == null) {
                store.commit(Changeset.builder().owner(config.owner()).build());
                log.info("Registry initialized with owner {}", config.owner());
            } else if (!current.equals(config.owner())) {
                log.info("Registry store already owned by {}, configured owner {} ignored", current, config.owner());
            }
        }
    }

    // ========== Authorization ==========

    @Override
    public void grantContributor(Identity caller, Identity identity, String name) {
        synchronized (writeLock) {
            requireOwner(caller, "grantContributor");
            if (Identity.isNullOrZero(identity)) {
                throw rejected(RegistryException.invalidArgument("identity cannot be null or zero"));
            }
            requireText("name", name);

            Contributor current = store.findContributor(identity);
            if (current != null && current.authorized()) {
                throw rejected(RegistryException.alreadyAuthorized(identity + " is already authorized"));
            }

            long now = clock.millis();
            store.commit(Changeset.builder()
                .putContributor(Contributor.authorized(identity, name))
                .build());
            publish(new ContributorAuthorized(identity, name, now));

            log.info("Contributor authorized: {} ({})", identity, name);
        }
    }

    @Override
    public void revokeContributor(Identity caller, Identity identity) {
        synchronized (writeLock) {
            requireOwner(caller, "revokeContributor");

            Contributor current = identity == null ? null : store.findContributor(identity);
            if (current == null || !current.authorized()) {
                throw rejected(RegistryException.notAuthorized(identity + " is not authorized"));
            }

            long now = clock.millis();
            store.commit(Changeset.builder()
                .putContributor(current.revoke())
                .build());
            publish(new ContributorRevoked(identity, now));

            log.info("Contributor revoked: {}", identity);
        }
    }

    @Override
    public Contributor getContributor(Identity identity) {
        if (identity == null) {
            throw RegistryException.invalidArgument("identity cannot be null");
        }
        Contributor contributor = store.findContributor(identity);
        return contributor != null ? contributor : Contributor.unknown(identity);
    }

    @Override
    public Identity owner() {
        return store.getOwner();
    }

    @Override
    public void transferOwnership(Identity caller, Identity newOwner) {
        synchronized (writeLock) {
            Identity previous = requireOwner(caller, "transferOwnership");
            if (!config.ownershipTransferable()) {
                throw rejected(RegistryException.forbidden("ownership transfer is disabled"));
            }
            if (Identity.isNullOrZero(newOwner)) {
                throw rejected(RegistryException.invalidArgument("newOwner cannot be null or zero"));
            }

            long now = clock.millis();
            store.commit(Changeset.builder().owner(newOwner).build());
            publish(new OwnershipTransferred(previous, newOwner, now));

            log.info("Ownership transferred: {} → {}", previous, newOwner);
        }
    }

    // ========== Record Lifecycle ==========

    @Override
    public RecordId createRecord(Identity caller, String scientificName, String habitat, String dataHash) {
        synchronized (writeLock) {
            Contributor contributor = caller == null ? null : store.findContributor(caller);
            if (contributor == null || !contributor.authorized()) {
                throw rejected(RegistryException.unauthorized(caller + " is not an authorized contributor"));
            }
            requireText("scientificName", scientificName);
            requireText("habitat", habitat);
            requireText("dataHash", dataHash);

            RecordId recordId = store.lastRecordId().next();
            long now = clock.millis();
            SpeciesRecord record = SpeciesRecord.create(recordId, scientificName, habitat, dataHash, caller, now);

            store.commit(Changeset.builder()
                .putRecord(record)
                .appendToIndex(caller, recordId)
                .build());
            publish(new RecordCreated(recordId, scientificName, habitat, dataHash, caller, now));

            log.info("Record created: {} by {} ({}, {})", recordId, caller, scientificName, habitat);
            return recordId;
        }
    }

    @Override
    public void updateRecord(Identity caller, RecordId recordId, String newDataHash) {
        synchronized (writeLock) {
            SpeciesRecord record = requireActiveRecord(recordId);
            if (!record.creator().equals(caller)) {
                throw rejected(RegistryException.forbidden(caller + " is not the creator of " + recordId));
            }
            requireText("newDataHash", newDataHash);

            long now = clock.millis();
            store.commit(Changeset.builder()
                .putRecord(record.withDataHash(newDataHash, now))
                .build());
            publish(new RecordUpdated(recordId, newDataHash, now));

            log.info("Record updated: {} by {}", recordId, caller);
        }
    }

    @Override
    public void deactivateRecord(Identity caller, RecordId recordId) {
        synchronized (writeLock) {
            SpeciesRecord record = requireActiveRecord(recordId);
            boolean creator = record.creator().equals(caller);
            if (!creator && !store.getOwner().equals(caller)) {
                throw rejected(RegistryException.forbidden(caller + " is neither the creator of " + recordId + " nor the owner"));
            }

            long now = clock.millis();
            store.commit(Changeset.builder()
                .putRecord(record.deactivate())
                .build());
            publish(new RecordDeactivated(recordId, now));

            log.info("Record deactivated: {} by {} ({})", recordId, caller, creator ? "creator" : "owner");
        }
    }

    // ========== Queries ==========

    @Override
    public SpeciesRecord getRecord(RecordId recordId) {
        SpeciesRecord record = recordId == null || recordId.isZero() ? null : store.findRecord(recordId);
        if (record == null) {
            throw RegistryException.notFound("record not found: " + recordId);
        }
        return record;
    }

    @Override
    public List<RecordId> getContributorRecords(Identity identity) {
        if (identity == null) {
            throw RegistryException.invalidArgument("identity cannot be null");
        }
        return store.findRecordIdsByCreator(identity);
    }

    @Override
    public List<SpeciesRecord> listRecords(RecordId fromInclusive, int limit) {
        if (fromInclusive == null) {
            throw RegistryException.invalidArgument("fromInclusive cannot be null");
        }
        if (limit <= 0) {
            throw RegistryException.invalidArgument("limit must be positive (current: " + limit + ")");
        }
        RecordId from = fromInclusive.isZero() ? fromInclusive.next() : fromInclusive;
        return store.listRecords(from, limit);
    }

    @Override
    public long recordCount() {
        return store.lastRecordId().getValue();
    }

    // ========== Guards ==========

    /**
     * 호출자가 현재 Owner인지 검증.
     *
     * @return 현재 Owner
     */
    private Identity requireOwner(Identity caller, String operation) {
        Identity owner = store.getOwner();
        if (caller == null || !owner.equals(caller)) {
            throw rejected(RegistryException.unauthorized(operation + " requires the owner, caller was " + caller));
        }
        return owner;
    }

    /**
     * 존재하지 않는 레코드는 비활성 레코드의 특수한 경우로 취급합니다.
     */
    private SpeciesRecord requireActiveRecord(RecordId recordId) {
        SpeciesRecord record = recordId == null || recordId.isZero() ? null : store.findRecord(recordId);
        if (record == null || !record.isActive()) {
            throw rejected(RegistryException.inactive("record is absent or inactive: " + recordId));
        }
        return record;
    }

    private void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw rejected(RegistryException.invalidArgument(field + " cannot be null or blank"));
        }
    }

    private RegistryException rejected(RegistryException e) {
        log.debug("Command rejected: {} - {}", e.getErrorCode(), e.getMessage());
        return e;
    }

    /**
     * 커밋 이후 이벤트 발행.
     *
     * <p>상태는 이미 커밋되었으므로 버스 장애는 호출자에게 전파하지 않습니다.
     * 발행에 실패한 이벤트는 미전달 큐에 남아 다음 발행 시 먼저 재전달됩니다
     * (at-least-once, 커밋 순서 유지). 쓰기 잠금 보유 중에만 호출됩니다.</p>
     */
    private void publish(RegistryEvent event) {
        undelivered.addLast(event);
        drainUndelivered();
    }

    private void drainUndelivered() {
        while (!undelivered.isEmpty()) {
            RegistryEvent next = undelivered.peekFirst();
            try {
                eventBus.publish(next);
            } catch (RuntimeException e) {
                log.error("Failed to publish {} after commit, {} event(s) pending redelivery",
                    next.eventType(), undelivered.size(), e);
                return;
            }
            undelivered.pollFirst();
        }
    }

    /**
     * 재전달 대기 중인 이벤트 수.
     *
     * @return 미전달 이벤트 수
     */
    public int pendingEventCount() {
        synchronized (writeLock) {
            return undelivered.size();
        }
    }
}
