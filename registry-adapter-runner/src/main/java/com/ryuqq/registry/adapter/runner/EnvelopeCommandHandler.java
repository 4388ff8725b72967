package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.command.RegistryCommandHandler;
import com.ryuqq.registry.application.registry.Registry;
import com.ryuqq.registry.core.contract.CreateRecord;
import com.ryuqq.registry.core.contract.DeactivateRecord;
import com.ryuqq.registry.core.contract.Envelope;
import com.ryuqq.registry.core.contract.GrantContributor;
import com.ryuqq.registry.core.contract.RegistryCommand;
import com.ryuqq.registry.core.contract.RevokeContributor;
import com.ryuqq.registry.core.contract.TransferOwnership;
import com.ryuqq.registry.core.contract.UpdateRecord;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.outcome.Fail;
import com.ryuqq.registry.core.outcome.Ok;
import com.ryuqq.registry.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Envelope 명령을 {@link Registry} 호출로 변환하는 핸들러.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Envelope에서 호출자와 명령 추출</li>
 *   <li>명령 유형에 따라 Registry 메서드 호출</li>
 *   <li>성공 시: Ok (CREATE_RECORD는 새 레코드 ID 포함)</li>
 *   <li>RegistryException 발생 시: Fail (오류 코드 + 메시지)</li>
 * </ol>
 *
 * <p>Stateless 설계: 인스턴스 간 상태 공유 없음 (thread-safe).</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class EnvelopeCommandHandler implements RegistryCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeCommandHandler.class);

    private final Registry registry;

    /**
     * 생성자.
     *
     * @param registry 명령을 적용할 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public EnvelopeCommandHandler(Registry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public Outcome handle(Envelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }

        RegistryCommand command = envelope.command();
        try {
            Outcome outcome = dispatch(envelope.caller(), command);
            log.debug("Command {} from {} applied (acceptedAt={})",
                command.commandName(), envelope.caller(), envelope.acceptedAt());
            return outcome;
        } catch (RegistryException e) {
            log.warn("Command {} from {} rejected: {} ({})",
                command.commandName(), envelope.caller(), e.getErrorCode(), e.getMessage());
            return Fail.from(e);
        }
    }

    private Outcome dispatch(Identity caller, RegistryCommand command) {
        if (command instanceof GrantContributor grant) {
            registry.grantContributor(caller, grant.identity(), grant.name());
        } else if (command instanceof RevokeContributor revoke) {
            registry.revokeContributor(caller, revoke.identity());
        } else if (command instanceof CreateRecord create) {
            RecordId recordId = registry.createRecord(caller, create.scientificName(), create.habitat(), create.dataHash());
            return Ok.created(command.commandName(), recordId);
        } else if (command instanceof UpdateRecord update) {
            registry.updateRecord(caller, update.recordId(), update.newDataHash());
        } else if (command instanceof DeactivateRecord deactivate) {
            registry.deactivateRecord(caller, deactivate.recordId());
        } else if (command instanceof TransferOwnership transfer) {
            registry.transferOwnership(caller, transfer.newOwner());
        } else {
            throw new IllegalStateException("Unsupported command: " + command);
        }
        return Ok.of(command.commandName());
    }
}
