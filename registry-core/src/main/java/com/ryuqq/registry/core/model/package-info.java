/**
 * Core value objects of the species registry.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.model.Identity} - Caller / contributor identifier, with a reserved zero value</li>
 *   <li>{@link com.ryuqq.registry.core.model.RecordId} - Sequential record identifier, {@code 0} meaning "does not exist"</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.model;
