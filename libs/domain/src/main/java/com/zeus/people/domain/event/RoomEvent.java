package com.zeus.people.domain.event;

import com.zeus.people.domain.valueobject.RoomNr;

import java.time.Instant;
import java.util.UUID;

/** Events raised by the {@code Room} aggregate. */
public sealed interface RoomEvent extends DomainEvent {

    UUID roomId();

    @Override
    default UUID aggregateId() {
        return roomId();
    }

    record Created(
            UUID eventId, Instant occurredAt, int version, UUID roomId, RoomNr roomNr, UUID buildingId)
            implements RoomEvent {
        @Override
        public EventType eventType() {
            return EventType.ROOM_CREATED;
        }
    }

    record OccupantAdded(UUID eventId, Instant occurredAt, int version, UUID roomId, UUID academicId)
            implements RoomEvent {
        @Override
        public EventType eventType() {
            return EventType.ROOM_OCCUPANT_ADDED;
        }
    }

    record OccupantRemoved(UUID eventId, Instant occurredAt, int version, UUID roomId, UUID academicId)
            implements RoomEvent {
        @Override
        public EventType eventType() {
            return EventType.ROOM_OCCUPANT_REMOVED;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID roomId) implements RoomEvent {
        @Override
        public EventType eventType() {
            return EventType.ROOM_DELETED;
        }
    }
}
