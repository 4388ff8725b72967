package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.spi.RegistryEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Listener that records every received event in delivery order.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class RecordingEventListener implements RegistryEventListener {

    private final List<RegistryEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(RegistryEvent event) {
        events.add(event);
    }

    /**
     * Snapshot of received events.
     *
     * @return immutable list in delivery order
     */
    public List<RegistryEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Received events of the given type.
     *
     * @param type event class
     * @param <T> event type
     * @return immutable list in delivery order
     */
    public <T extends RegistryEvent> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Last received event.
     *
     * @return last event
     * @throws IllegalStateException if nothing was received
     */
    public RegistryEvent last() {
        if (events.isEmpty()) {
            throw new IllegalStateException("No event received");
        }
        return events.get(events.size() - 1);
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
