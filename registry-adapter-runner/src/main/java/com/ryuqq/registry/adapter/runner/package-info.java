/**
 * Registry runtime: the single-writer {@link com.ryuqq.registry.application.registry.Registry}
 * implementation, the envelope command handler and their configuration.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.adapter.runner.SerializedRegistry} - Serialized write path, lock-free reads</li>
 *   <li>{@link com.ryuqq.registry.adapter.runner.EnvelopeCommandHandler} - Envelope → Registry call, exceptions → Fail</li>
 *   <li>{@link com.ryuqq.registry.adapter.runner.RegistryConfig} - Initial owner and transfer policy</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.adapter.runner;
