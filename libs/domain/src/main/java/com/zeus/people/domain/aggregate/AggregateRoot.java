package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.DomainEvent;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A consistency boundary whose state changes only by applying events of family {@code E}.
 *
 * @param <E> the sealed event family raised by this aggregate
 */
public interface AggregateRoot<E extends DomainEvent> {

    UUID id();

    AggregateType aggregateType();

    /** Version of the last applied event; 0 before the creation event. */
    int version();

    Instant createdAt();

    Instant modifiedAt();

    /** True once the aggregate's deletion event has been applied. */
    boolean isDeleted();

    /** Events raised since the aggregate was loaded or last committed, in raise order. */
    List<E> uncommittedEvents();

    /** Clears the uncommitted list after the events have been appended to the store. */
    void markEventsAsCommitted();

    /** Version the store is expected to hold before the uncommitted events are appended. */
    default int committedVersion() {
        return version() - uncommittedEvents().size();
    }
}
