/**
 * Command contracts of the registry.
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.contract.RegistryCommand} - Sealed command hierarchy</li>
 *   <li>{@link com.ryuqq.registry.core.contract.Envelope} - Command with caller identity and acceptance time</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.contract;
