/**
 * Registry notifications.
 *
 * <p>The event stream is the durable audit log for external collaborators. Events are
 * emitted once per committed command, in commit order.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.event;
