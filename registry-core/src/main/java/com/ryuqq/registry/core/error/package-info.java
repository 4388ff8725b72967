/**
 * Registry error taxonomy.
 *
 * <p>{@link com.ryuqq.registry.core.error.RegistryException} carries a
 * {@link com.ryuqq.registry.core.error.RegistryErrorCode}; every precondition failure
 * aborts the whole command with no state change.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.error;
