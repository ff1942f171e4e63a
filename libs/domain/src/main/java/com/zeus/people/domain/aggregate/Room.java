package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.RoomEvent;
import com.zeus.people.domain.rules.BusinessRule;
import com.zeus.people.domain.valueobject.RoomNr;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import static com.zeus.people.domain.aggregate.Invariants.require;
import static com.zeus.people.domain.aggregate.Invariants.requireId;
import static com.zeus.people.domain.aggregate.Invariants.requireNotDeleted;

/** A room in a building, occupied by zero or more academics. */
public final class Room implements AggregateRoot<RoomEvent> {

    private final EventSourcedEntity<RoomEvent> entity;

    private RoomNr roomNr;
    private UUID buildingId;
    private final Set<UUID> occupantIds = new LinkedHashSet<>();
    private boolean deleted;

    private Room(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static Room create(RoomNr roomNr, UUID buildingId, Clock clock) {
        return create(UUID.randomUUID(), roomNr, buildingId, clock);
    }

    public static Room create(UUID id, RoomNr roomNr, UUID buildingId, Clock clock) {
        Objects.requireNonNull(roomNr, "roomNr");
        requireId(buildingId, "Building id");
        Room room = new Room(clock);
        room.entity.raise((eventId, at, v) ->
                new RoomEvent.Created(eventId, at, v, requireId(id, "Room id"), roomNr, buildingId));
        return room;
    }

    public static Room reconstruct(List<? extends RoomEvent> events, Clock clock) {
        Room room = new Room(clock);
        room.entity.replay(events);
        return room;
    }

    public static Room reconstruct(List<? extends RoomEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public void addOccupant(UUID academicId) {
        requireId(academicId, "Academic id");
        requireNotDeleted(this);
        require(!occupantIds.contains(academicId),
                BusinessRule.DUPLICATE_ASSOCIATION,
                "Academic " + academicId + " already occupies room " + roomNr);
        entity.raise((eventId, at, v) -> new RoomEvent.OccupantAdded(eventId, at, v, id(), academicId));
    }

    public void removeOccupant(UUID academicId) {
        requireId(academicId, "Academic id");
        requireNotDeleted(this);
        require(occupantIds.contains(academicId),
                BusinessRule.UNKNOWN_ASSOCIATION,
                "Academic " + academicId + " does not occupy room " + roomNr);
        entity.raise((eventId, at, v) -> new RoomEvent.OccupantRemoved(eventId, at, v, id(), academicId));
    }

    public void delete() {
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new RoomEvent.Deleted(eventId, at, v, id()));
    }

    private void apply(RoomEvent event) {
        switch (event.eventType()) {
            case ROOM_CREATED -> {
                var e = (RoomEvent.Created) event;
                roomNr = e.roomNr();
                buildingId = e.buildingId();
            }
            case ROOM_OCCUPANT_ADDED -> occupantIds.add(((RoomEvent.OccupantAdded) event).academicId());
            case ROOM_OCCUPANT_REMOVED -> occupantIds.remove(((RoomEvent.OccupantRemoved) event).academicId());
            case ROOM_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not a room event: " + event.eventType());
        }
    }

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.ROOM;
    }

    @Override
    public int version() {
        return entity.version();
    }

    @Override
    public Instant createdAt() {
        return entity.createdAt();
    }

    @Override
    public Instant modifiedAt() {
        return entity.modifiedAt();
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public List<RoomEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public RoomNr roomNr() {
        return roomNr;
    }

    public UUID buildingId() {
        return buildingId;
    }

    public Set<UUID> occupantIds() {
        return Collections.unmodifiableSet(occupantIds);
    }
}
