/**
 * Reusable contract tests for {@link com.ryuqq.registry.core.spi.RegistryStore} and
 * {@link com.ryuqq.registry.core.spi.EventBus} implementations.
 *
 * <h2>Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.testkit.contract.AuthorizationContract} - Grant, revoke, contributor reads</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.RecordLifecycleContract} - Create, update, deactivate, record reads</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.AtomicityContract} - All-or-nothing changeset commits</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.EventStreamContract} - Event order and listener isolation</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.ConcurrencyContract} - Single-writer serialization</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.OwnershipContract} - Owner initialization and transfer</li>
 *   <li>{@link com.ryuqq.registry.testkit.contract.CommandEnvelopeContract} - Envelope entry point</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <p>Extend each contract with a concrete test class that returns fresh SPI instances from
 * {@code newStore()} and {@code newEventBus()}.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.testkit.contract;
