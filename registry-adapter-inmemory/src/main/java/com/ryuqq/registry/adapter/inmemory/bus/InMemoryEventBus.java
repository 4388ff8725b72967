package com.ryuqq.registry.adapter.inmemory.bus;

import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.spi.EventBus;
import com.ryuqq.registry.core.spi.RegistryEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link EventBus} SPI.
 *
 * <p>Delivers each event synchronously on the publishing thread to every subscribed
 * listener, in subscription order. Because the registry publishes while holding its
 * write lock, listeners observe events in commit order.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Listener isolation: a throwing listener is logged and skipped</li>
 *   <li>Opt-in published event history, a testing aid: enable it with
 *       {@link #InMemoryEventBus(boolean)}; a history-enabled bus grows without bound</li>
 *   <li>Thread-safe subscribe/unsubscribe using CopyOnWriteArrayList</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<RegistryEventListener> listeners;

    private final List<RegistryEvent> published;

    private final boolean recordHistory;

    /**
     * Creates a bus that keeps no event history.
     */
    public InMemoryEventBus() {
        this(false);
    }

    /**
     * @param recordHistory whether published events are retained for {@link #getPublishedEvents()}
     */
    public InMemoryEventBus(boolean recordHistory) {
        this.listeners = new CopyOnWriteArrayList<>();
        this.published = new CopyOnWriteArrayList<>();
        this.recordHistory = recordHistory;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>With history enabled, the event is recorded before delivery</li>
     *   <li>RuntimeException from a listener: logged at error level, delivery continues</li>
     * </ul>
     */
    @Override
    public void publish(RegistryEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }

        if (recordHistory) {
            published.add(event);
        }
        for (RegistryEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {}", listener, event.eventType(), e);
            }
        }
    }

    @Override
    public void subscribe(RegistryEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    @Override
    public boolean unsubscribe(RegistryEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        return listeners.remove(listener);
    }

    /**
     * Returns a snapshot of all events published so far, in publication order.
     * Always empty unless history was enabled at construction.
     *
     * @return immutable list of events
     */
    public List<RegistryEvent> getPublishedEvents() {
        return List.copyOf(published);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    /**
     * Clears listeners and history (testing utility).
     */
    public void clear() {
        listeners.clear();
        published.clear();
    }
}
