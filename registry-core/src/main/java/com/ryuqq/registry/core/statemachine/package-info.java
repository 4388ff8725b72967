/**
 * Record lifecycle state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.statemachine.RecordState} - Record lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.registry.core.statemachine.RecordTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * NONEXISTENT → ACTIVE (create)
 * ACTIVE → INACTIVE (deactivate)
 *
 * Forbidden:
 * - INACTIVE → * (terminal state)
 * - * → NONEXISTENT (no hard deletion)
 * </pre>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.statemachine;
