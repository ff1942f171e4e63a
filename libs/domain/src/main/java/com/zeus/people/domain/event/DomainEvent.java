package com.zeus.people.domain.event;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable, versioned record of a state change that happened to one aggregate.
 *
 * <p>The event hierarchy is a closed tagged union: one sealed family per aggregate type, each
 * member a record. {@link #eventType()} is the tag; serializers and aggregates dispatch on it
 * explicitly.
 */
public sealed interface DomainEvent
        permits AcademicEvent,
                DepartmentEvent,
                RoomEvent,
                BuildingEvent,
                ChairEvent,
                ExtensionEvent,
                CommitteeEvent,
                SubjectEvent,
                DegreeEvent,
                UniversityEvent {

    /** Globally unique identifier, assigned once when the event is raised. */
    UUID eventId();

    /** When the state change happened (UTC). */
    Instant occurredAt();

    /** Position of this event in its aggregate's stream, contiguous from 1. */
    int version();

    /** Identity of the aggregate this event belongs to. */
    UUID aggregateId();

    /** The tag identifying the concrete event type. */
    EventType eventType();
}
