/**
 * In-memory EventBus adapter implementation package.
 *
 * <p>Synchronous, ordered notification stream implementing
 * {@link com.ryuqq.registry.core.spi.EventBus}.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.registry.adapter.inmemory.bus.InMemoryEventBus}:
 *       Thread-safe listener registry with failure isolation and event history</li>
 * </ul>
 *
 * @see com.ryuqq.registry.core.spi.EventBus
 * @author Registry Team
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.inmemory.bus;
