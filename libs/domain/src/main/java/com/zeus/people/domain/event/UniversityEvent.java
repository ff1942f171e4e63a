package com.zeus.people.domain.event;

import java.time.Instant;
import java.util.UUID;

/** Events raised by the {@code University} aggregate. */
public sealed interface UniversityEvent extends DomainEvent {

    UUID universityId();

    @Override
    default UUID aggregateId() {
        return universityId();
    }

    record Created(UUID eventId, Instant occurredAt, int version, UUID universityId, String code)
            implements UniversityEvent {
        @Override
        public EventType eventType() {
            return EventType.UNIVERSITY_CREATED;
        }
    }

    record DegreeAdded(UUID eventId, Instant occurredAt, int version, UUID universityId, UUID degreeId)
            implements UniversityEvent {
        @Override
        public EventType eventType() {
            return EventType.UNIVERSITY_DEGREE_ADDED;
        }
    }

    record DegreeRemoved(UUID eventId, Instant occurredAt, int version, UUID universityId, UUID degreeId)
            implements UniversityEvent {
        @Override
        public EventType eventType() {
            return EventType.UNIVERSITY_DEGREE_REMOVED;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID universityId)
            implements UniversityEvent {
        @Override
        public EventType eventType() {
            return EventType.UNIVERSITY_DELETED;
        }
    }
}
