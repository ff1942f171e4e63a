package com.zeus.people.domain.event;

import java.time.Instant;
import java.util.UUID;

/** Events raised by the {@code Degree} aggregate. */
public sealed interface DegreeEvent extends DomainEvent {

    UUID degreeId();

    @Override
    default UUID aggregateId() {
        return degreeId();
    }

    record Created(UUID eventId, Instant occurredAt, int version, UUID degreeId, String code)
            implements DegreeEvent {
        @Override
        public EventType eventType() {
            return EventType.DEGREE_CREATED;
        }
    }

    /** {@code academicId} obtained the degree from {@code universityId}. */
    record Obtained(
            UUID eventId, Instant occurredAt, int version, UUID degreeId, UUID academicId, UUID universityId)
            implements DegreeEvent {
        @Override
        public EventType eventType() {
            return EventType.DEGREE_OBTAINED;
        }
    }

    record ObtainmentRemoved(UUID eventId, Instant occurredAt, int version, UUID degreeId, UUID academicId)
            implements DegreeEvent {
        @Override
        public EventType eventType() {
            return EventType.DEGREE_OBTAINMENT_REMOVED;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID degreeId)
            implements DegreeEvent {
        @Override
        public EventType eventType() {
            return EventType.DEGREE_DELETED;
        }
    }
}
