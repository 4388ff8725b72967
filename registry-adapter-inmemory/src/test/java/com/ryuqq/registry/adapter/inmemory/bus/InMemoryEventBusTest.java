package com.ryuqq.registry.adapter.inmemory.bus;

import com.ryuqq.registry.core.event.ContributorAuthorized;
import com.ryuqq.registry.core.event.ContributorRevoked;
import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.model.Identity;
import com.ryuqq.registry.core.spi.RegistryEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryEventBus 유닛 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class InMemoryEventBusTest {

    private static final Identity ALICE = Identity.of("0xALICE");

    private InMemoryEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryEventBus(true);
    }

    @Test
    void publish_구독_순서대로_전달() {
        // given
        List<String> calls = new ArrayList<>();
        bus.subscribe(event -> calls.add("first:" + event.eventType()));
        bus.subscribe(event -> calls.add("second:" + event.eventType()));

        // when
        bus.publish(new ContributorAuthorized(ALICE, "Lab A", 1L));

        // then
        assertThat(calls).containsExactly("first:ContributorAuthorized", "second:ContributorAuthorized");
    }

    @Test
    void publish_리스너_예외는_격리되고_이력에_기록() {
        // given
        List<RegistryEvent> received = new ArrayList<>();
        bus.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(received::add);
        RegistryEvent event = new ContributorRevoked(ALICE, 2L);

        // when
        bus.publish(event);

        // then
        assertThat(received).containsExactly(event);
        assertThat(bus.getPublishedEvents()).containsExactly(event);
    }

    @Test
    void publish_구독자_없어도_이력에_기록() {
        // when
        bus.publish(new ContributorAuthorized(ALICE, "Lab A", 1L));
        bus.publish(new ContributorRevoked(ALICE, 2L));

        // then
        assertThat(bus.getPublishedEvents())
            .extracting(RegistryEvent::eventType)
            .containsExactly("ContributorAuthorized", "ContributorRevoked");
    }

    @Test
    void 기본_생성자는_이력을_보관하지_않음() {
        // given
        InMemoryEventBus plainBus = new InMemoryEventBus();
        List<RegistryEvent> received = new ArrayList<>();
        plainBus.subscribe(received::add);

        // when
        plainBus.publish(new ContributorAuthorized(ALICE, "Lab A", 1L));

        // then
        assertThat(received).hasSize(1);
        assertThat(plainBus.getPublishedEvents()).isEmpty();
    }

    @Test
    void unsubscribe_이후_전달_안됨() {
        // given
        List<RegistryEvent> received = new ArrayList<>();
        RegistryEventListener listener = received::add;
        bus.subscribe(listener);

        // when
        boolean removed = bus.unsubscribe(listener);
        bus.publish(new ContributorRevoked(ALICE, 2L));

        // then
        assertThat(removed).isTrue();
        assertThat(received).isEmpty();
        assertThat(bus.getListenerCount()).isZero();
    }

    @Test
    void null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> bus.publish(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bus.subscribe(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bus.unsubscribe(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clear_리스너와_이력_초기화() {
        // given
        bus.subscribe(event -> { });
        bus.publish(new ContributorRevoked(ALICE, 2L));

        // when
        bus.clear();

        // then
        assertThat(bus.getListenerCount()).isZero();
        assertThat(bus.getPublishedEvents()).isEmpty();
    }
}
