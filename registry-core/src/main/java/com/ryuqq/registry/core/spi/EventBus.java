package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.event.RegistryEvent;

/**
 * Notification stream SPI for committed registry state changes.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Delivering every published event to all subscribed listeners</li>
 *   <li>Preserving publish order (publish order equals commit order)</li>
 *   <li>Isolating listener failures: a failing listener must not prevent delivery
 *       to other listeners, nor propagate back to the registry</li>
 * </ul>
 *
 * <p><strong>Delivery Semantics:</strong> at-least-once, ordered per commit.
 * Consumers must treat the stream as the durable audit log.
 * If {@link #publish} throws, the registry keeps the event and publishes it again,
 * ahead of newer events, on its next commit; consumers may therefore see an event
 * more than once.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Publishes an event after its command has been committed.
     *
     * @param event the committed event
     * @throws IllegalArgumentException if event is null
     * @throws RuntimeException if the event could not be handed off; the caller retries it
     */
    void publish(RegistryEvent event);

    /**
     * Registers a listener for all subsequently published events.
     *
     * @param listener the listener
     * @throws IllegalArgumentException if listener is null
     */
    void subscribe(RegistryEventListener listener);

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener
     * @return true if the listener was registered
     */
    boolean unsubscribe(RegistryEventListener listener);
}
