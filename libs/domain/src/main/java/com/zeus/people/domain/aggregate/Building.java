package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.BuildingEvent;
import com.zeus.people.domain.rules.BusinessRule;
import com.zeus.people.domain.valueobject.BldgName;
import com.zeus.people.domain.valueobject.BldgNr;

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

/** A building and the rooms it contains. */
public final class Building implements AggregateRoot<BuildingEvent> {

    private final EventSourcedEntity<BuildingEvent> entity;

    private BldgNr bldgNr;
    private BldgName bldgName;
    private final Set<UUID> roomIds = new LinkedHashSet<>();
    private boolean deleted;

    private Building(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static Building create(BldgNr bldgNr, BldgName bldgName, Clock clock) {
        return create(UUID.randomUUID(), bldgNr, bldgName, clock);
    }

    public static Building create(UUID id, BldgNr bldgNr, BldgName bldgName, Clock clock) {
        Objects.requireNonNull(bldgNr, "bldgNr");
        Objects.requireNonNull(bldgName, "bldgName");
        Building building = new Building(clock);
        building.entity.raise((eventId, at, v) ->
                new BuildingEvent.Created(eventId, at, v, requireId(id, "Building id"), bldgNr, bldgName));
        return building;
    }

    public static Building reconstruct(List<? extends BuildingEvent> events, Clock clock) {
        Building building = new Building(clock);
        building.entity.replay(events);
        return building;
    }

    public static Building reconstruct(List<? extends BuildingEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public void addRoom(UUID roomId) {
        requireId(roomId, "Room id");
        requireNotDeleted(this);
        require(!roomIds.contains(roomId),
                BusinessRule.DUPLICATE_ASSOCIATION,
                "Room " + roomId + " is already in building " + bldgNr);
        entity.raise((eventId, at, v) -> new BuildingEvent.RoomAdded(eventId, at, v, id(), roomId));
    }

    public void removeRoom(UUID roomId) {
        requireId(roomId, "Room id");
        requireNotDeleted(this);
        require(roomIds.contains(roomId),
                BusinessRule.UNKNOWN_ASSOCIATION,
                "Room " + roomId + " is not in building " + bldgNr);
        entity.raise((eventId, at, v) -> new BuildingEvent.RoomRemoved(eventId, at, v, id(), roomId));
    }

    public void delete() {
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new BuildingEvent.Deleted(eventId, at, v, id()));
    }

    private void apply(BuildingEvent event) {
        switch (event.eventType()) {
            case BUILDING_CREATED -> {
                var e = (BuildingEvent.Created) event;
                bldgNr = e.bldgNr();
                bldgName = e.bldgName();
            }
            case BUILDING_ROOM_ADDED -> roomIds.add(((BuildingEvent.RoomAdded) event).roomId());
            case BUILDING_ROOM_REMOVED -> roomIds.remove(((BuildingEvent.RoomRemoved) event).roomId());
            case BUILDING_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not a building event: " + event.eventType());
        }
    }

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.BUILDING;
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
    public List<BuildingEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public BldgNr bldgNr() {
        return bldgNr;
    }

    public BldgName bldgName() {
        return bldgName;
    }

    public Set<UUID> roomIds() {
        return Collections.unmodifiableSet(roomIds);
    }
}
