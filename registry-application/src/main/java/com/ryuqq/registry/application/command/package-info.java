/**
 * Envelope-based command entry point.
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.application.command;
