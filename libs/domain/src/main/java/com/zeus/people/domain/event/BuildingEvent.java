package com.zeus.people.domain.event;

import com.zeus.people.domain.valueobject.BldgName;
import com.zeus.people.domain.valueobject.BldgNr;

import java.time.Instant;
import java.util.UUID;

/** Events raised by the {@code Building} aggregate. */
public sealed interface BuildingEvent extends DomainEvent {

    UUID buildingId();

    @Override
    default UUID aggregateId() {
        return buildingId();
    }

    record Created(
            UUID eventId,
            Instant occurredAt,
            int version,
            UUID buildingId,
            BldgNr bldgNr,
            BldgName bldgName)
            implements BuildingEvent {
        @Override
        public EventType eventType() {
            return EventType.BUILDING_CREATED;
        }
    }

    record RoomAdded(UUID eventId, Instant occurredAt, int version, UUID buildingId, UUID roomId)
            implements BuildingEvent {
        @Override
        public EventType eventType() {
            return EventType.BUILDING_ROOM_ADDED;
        }
    }

    record RoomRemoved(UUID eventId, Instant occurredAt, int version, UUID buildingId, UUID roomId)
            implements BuildingEvent {
        @Override
        public EventType eventType() {
            return EventType.BUILDING_ROOM_REMOVED;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID buildingId)
            implements BuildingEvent {
        @Override
        public EventType eventType() {
            return EventType.BUILDING_DELETED;
        }
    }
}
