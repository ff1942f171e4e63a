package com.zeus.people.eventstore;

import com.zeus.people.domain.event.DomainEvent;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Precondition checks every {@link EventStore} applies before touching storage. */
public final class AppendBatches {

    private AppendBatches() {
        // utility class
    }

    /**
     * @throws IllegalArgumentException if the batch is empty, belongs to another aggregate or its
     *     versions do not run contiguously from {@code expectedVersion + 1}
     */
    public static void validate(UUID aggregateId, List<? extends DomainEvent> events, int expectedVersion) {
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Cannot append an empty batch to aggregate " + aggregateId);
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion must not be negative: " + expectedVersion);
        }
        int next = expectedVersion + 1;
        for (DomainEvent event : events) {
            if (!aggregateId.equals(event.aggregateId())) {
                throw new IllegalArgumentException(
                        "Event " + event.eventId() + " belongs to aggregate " + event.aggregateId()
                                + ", not " + aggregateId);
            }
            if (event.version() != next) {
                throw new IllegalArgumentException(
                        "Event " + event.eventType().value() + " has version " + event.version()
                                + " but " + next + " was expected");
            }
            next++;
        }
    }
}
