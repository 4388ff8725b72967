/**
 * Registry operation surface.
 *
 * <p>{@link com.ryuqq.registry.application.registry.Registry} groups the authorization,
 * record lifecycle and query operations. Implementations live in adapter modules.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.application.registry;
