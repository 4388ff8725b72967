package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.registry.Registry;
import com.ryuqq.registry.core.contract.CreateRecord;
import com.ryuqq.registry.core.contract.DeactivateRecord;
import com.ryuqq.registry.core.contract.Envelope;
import com.ryuqq.registry.core.contract.GrantContributor;
import com.ryuqq.registry.core.contract.RegistryCommand;
import com.ryuqq.registry.core.contract.RevokeContributor;
import com.ryuqq.registry.core.contract.TransferOwnership;
import com.ryuqq.registry.core.contract.UpdateRecord;
import com.ryuqq.registry.core.error.RegistryErrorCode;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.model.RecordId;
import com.ryuqq.registry.core.outcome.Fail;
import com.ryuqq.registry.core.outcome.Ok;
import com.ryuqq.registry.core.outcome.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * EnvelopeCommandHandler 유닛 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EnvelopeCommandHandlerTest {

    private static final Identity OWNER = Identity.of("0xOWNER");
    private static final Identity ALICE = Identity.of("0xALICE");

    @Mock
    private Registry registry;

    private EnvelopeCommandHandler handler;

    @BeforeEach
    void setUp() {
        handler = new EnvelopeCommandHandler(registry);
    }

    private Outcome handle(Identity caller, RegistryCommand command) {
        return handler.handle(Envelope.of(caller, command, 100L));
    }

    @Test
    void handle_CreateRecord_Ok에_새_레코드_ID_포함() {
        // given
        when(registry.createRecord(ALICE, "Rana temporaria", "wetlands", "hash1")).thenReturn(RecordId.of(3));

        // when
        Outcome outcome = handle(ALICE, new CreateRecord("Rana temporaria", "wetlands", "hash1"));

        // then
        assertThat(outcome).isEqualTo(Ok.created("CREATE_RECORD", RecordId.of(3)));
    }

    @Test
    void handle_각_명령은_대응하는_Registry_메서드로_위임() {
        // when
        Outcome granted = handle(OWNER, new GrantContributor(ALICE, "Lab A"));
        Outcome revoked = handle(OWNER, new RevokeContributor(ALICE));
        Outcome updated = handle(ALICE, new UpdateRecord(RecordId.of(1), "hash2"));
        Outcome deactivated = handle(ALICE, new DeactivateRecord(RecordId.of(1)));
        Outcome transferred = handle(OWNER, new TransferOwnership(ALICE));

        // then
        verify(registry).grantContributor(OWNER, ALICE, "Lab A");
        verify(registry).revokeContributor(OWNER, ALICE);
        verify(registry).updateRecord(ALICE, RecordId.of(1), "hash2");
        verify(registry).deactivateRecord(ALICE, RecordId.of(1));
        verify(registry).transferOwnership(OWNER, ALICE);
        verifyNoMoreInteractions(registry);

        assertThat(granted).isEqualTo(Ok.of("GRANT_CONTRIBUTOR"));
        assertThat(revoked).isEqualTo(Ok.of("REVOKE_CONTRIBUTOR"));
        assertThat(updated).isEqualTo(Ok.of("UPDATE_RECORD"));
        assertThat(deactivated).isEqualTo(Ok.of("DEACTIVATE_RECORD"));
        assertThat(transferred).isEqualTo(Ok.of("TRANSFER_OWNERSHIP"));
    }

    @Test
    void handle_RegistryException은_Fail로_변환() {
        // given
        doThrow(RegistryException.forbidden("not the creator"))
            .when(registry).updateRecord(OWNER, RecordId.of(1), "hash2");

        // when
        Outcome outcome = handle(OWNER, new UpdateRecord(RecordId.of(1), "hash2"));

        // then
        assertThat(outcome.isFail()).isTrue();
        assertThat(outcome).isEqualTo(Fail.of(RegistryErrorCode.FORBIDDEN, "not the creator"));
    }

    @Test
    void handle_프로그래밍_오류는_Fail로_숨기지_않고_전파() {
        // given
        doThrow(new IllegalStateException("store invariant"))
            .when(registry).deactivateRecord(ALICE, RecordId.of(1));

        // when & then
        assertThatThrownBy(() -> handle(ALICE, new DeactivateRecord(RecordId.of(1))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("store invariant");
    }

    @Test
    void handle_null_envelope이면_예외() {
        assertThatThrownBy(() -> handler.handle(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("envelope cannot be null");
        verifyNoInteractions(registry);
    }

    @Test
    void 생성자_null_registry면_예외() {
        assertThatThrownBy(() -> new EnvelopeCommandHandler(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
