/**
 * Command outcomes.
 *
 * <p>{@link com.ryuqq.registry.core.outcome.Outcome} is a sealed interface with two cases:
 * {@link com.ryuqq.registry.core.outcome.Ok} and {@link com.ryuqq.registry.core.outcome.Fail}.
 * There is no retry case; registry failures are never transient.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.outcome;
