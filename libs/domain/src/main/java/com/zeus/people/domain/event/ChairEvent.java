package com.zeus.people.domain.event;

import java.time.Instant;
import java.util.UUID;

/** Events raised by the {@code Chair} aggregate. */
public sealed interface ChairEvent extends DomainEvent {

    UUID chairId();

    @Override
    default UUID aggregateId() {
        return chairId();
    }

    record Created(UUID eventId, Instant occurredAt, int version, UUID chairId, String name)
            implements ChairEvent {
        @Override
        public EventType eventType() {
            return EventType.CHAIR_CREATED;
        }
    }

    record AssignedToProfessor(
            UUID eventId, Instant occurredAt, int version, UUID chairId, UUID professorId)
            implements ChairEvent {
        @Override
        public EventType eventType() {
            return EventType.CHAIR_ASSIGNED_TO_PROFESSOR;
        }
    }

    record ProfessorReleased(UUID eventId, Instant occurredAt, int version, UUID chairId, UUID professorId)
            implements ChairEvent {
        @Override
        public EventType eventType() {
            return EventType.CHAIR_PROFESSOR_RELEASED;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID chairId) implements ChairEvent {
        @Override
        public EventType eventType() {
            return EventType.CHAIR_DELETED;
        }
    }
}
