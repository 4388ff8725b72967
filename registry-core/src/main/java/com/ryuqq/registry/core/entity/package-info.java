/**
 * Registry entities: contributors and species records.
 *
 * <p>Both entity types follow an append-and-flag model: entries are never deleted,
 * only their status fields change ({@code authorized} for contributors,
 * {@code state} for records). Entities are immutable records; every change yields
 * a new instance that the store swaps in atomically.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.entity;
