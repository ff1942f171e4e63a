package com.zeus.people.domain.event;

import com.zeus.people.domain.valueobject.ExtNr;

import java.time.Instant;
import java.util.UUID;

/** Events raised by the {@code Extension} aggregate. */
public sealed interface ExtensionEvent extends DomainEvent {

    UUID extensionId();

    @Override
    default UUID aggregateId() {
        return extensionId();
    }

    record Created(UUID eventId, Instant occurredAt, int version, UUID extensionId, ExtNr extNr)
            implements ExtensionEvent {
        @Override
        public EventType eventType() {
            return EventType.EXTENSION_CREATED;
        }
    }

    record AssignedToAcademic(
            UUID eventId, Instant occurredAt, int version, UUID extensionId, UUID academicId)
            implements ExtensionEvent {
        @Override
        public EventType eventType() {
            return EventType.EXTENSION_ASSIGNED_TO_ACADEMIC;
        }
    }

    record AcademicReleased(
            UUID eventId, Instant occurredAt, int version, UUID extensionId, UUID academicId)
            implements ExtensionEvent {
        @Override
        public EventType eventType() {
            return EventType.EXTENSION_ACADEMIC_RELEASED;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID extensionId)
            implements ExtensionEvent {
        @Override
        public EventType eventType() {
            return EventType.EXTENSION_DELETED;
        }
    }
}
