/**
 * In-memory RegistryStore adapter implementation package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.registry.core.spi.RegistryStore} SPI used by contract tests
 * and by embedded, non-durable registries.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.registry.adapter.inmemory.store.InMemoryRegistryStore}:
 *       Thread-safe, append-and-flag state store with atomic changeset commits</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.registry.core.spi.RegistryStore
 * @author Registry Team
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.inmemory.store;
