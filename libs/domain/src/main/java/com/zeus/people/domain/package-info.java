/**
 * Domain layer of the Zeus People system: value objects, domain events, event-sourced aggregates
 * and the business-rule service.
 *
 * <ul>
 *   <li>{@code valueobject} — immutable, self-validating scalars
 *   <li>{@code event} — the tagged union of domain events, one sealed family per aggregate
 *   <li>{@code aggregate} — consistency boundaries whose state changes only by applying events
 *   <li>{@code rules} — pure checks for invariants spanning several aggregates
 * </ul>
 *
 * <p>Nothing in this package depends on persistence, serialization or Spring.
 */
package com.zeus.people.domain;
