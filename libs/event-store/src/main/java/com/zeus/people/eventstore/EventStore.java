package com.zeus.people.eventstore;

import com.zeus.people.domain.event.DomainEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only, per-aggregate event log with optimistic concurrency.
 *
 * <p>Each append touches exactly one aggregate's stream and either commits all of its events or
 * none. Reads return version-ordered, gap-free snapshots.
 */
public interface EventStore {

    /**
     * Appends {@code events} to the stream of {@code aggregateId} if its current version equals
     * {@code expectedVersion}.
     *
     * @param aggregateType canonical aggregate type name stored with every envelope
     * @param events non-empty; versions must run from {@code expectedVersion + 1} without gaps
     * @throws ConcurrencyConflictException if the stream is not at {@code expectedVersion}
     * @throws EventStoreException on any other storage failure
     * @throws IllegalArgumentException if the batch is empty or its versions do not line up
     */
    default AppendResult appendEvents(
            UUID aggregateId, String aggregateType, List<? extends DomainEvent> events, int expectedVersion) {
        return appendEvents(aggregateId, aggregateType, events, expectedVersion, ClaimSet.none());
    }

    /**
     * As {@link #appendEvents(UUID, String, List, int)}, additionally acquiring and releasing
     * {@code claims} in the same transaction.
     *
     * @throws UniqueClaimConflictException if a claim is held by another aggregate
     */
    AppendResult appendEvents(
            UUID aggregateId,
            String aggregateType,
            List<? extends DomainEvent> events,
            int expectedVersion,
            ClaimSet claims);

    /** All events of the aggregate in version order; empty if the aggregate has no events. */
    List<DomainEvent> getEvents(UUID aggregateId);

    /** Events with a version strictly greater than {@code fromVersionExclusive}, in version order. */
    List<DomainEvent> getEventsFromVersion(UUID aggregateId, int fromVersionExclusive);

    /**
     * Events of every aggregate recorded at or after {@code cutoff}, ordered by timestamp, then
     * aggregate id, then version.
     */
    List<DomainEvent> getEventsFromTimestamp(Instant cutoff);

    /** Version of the aggregate's last event, 0 if it has none. */
    int currentVersion(UUID aggregateId);

    /** Raw envelopes of the aggregate in version order. */
    List<StoredEvent> getStoredEvents(UUID aggregateId);

    /** Aggregate currently holding {@code claimKey}, if any. */
    Optional<UUID> claimHolder(String claimKey);
}
