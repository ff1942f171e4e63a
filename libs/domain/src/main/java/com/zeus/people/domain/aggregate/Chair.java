package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.ChairEvent;
import com.zeus.people.domain.rules.BusinessRule;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.zeus.people.domain.aggregate.Invariants.require;
import static com.zeus.people.domain.aggregate.Invariants.requireId;
import static com.zeus.people.domain.aggregate.Invariants.requireName;
import static com.zeus.people.domain.aggregate.Invariants.requireNotDeleted;

/** A named chair, held by at most one professor. */
public final class Chair implements AggregateRoot<ChairEvent> {

    static final int MAX_NAME_LENGTH = 100;

    private final EventSourcedEntity<ChairEvent> entity;

    private String name;
    private UUID professorId;
    private boolean deleted;

    private Chair(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static Chair create(String name, Clock clock) {
        return create(UUID.randomUUID(), name, clock);
    }

    public static Chair create(UUID id, String name, Clock clock) {
        String validName = requireName(name, "Chair name", MAX_NAME_LENGTH);
        Chair chair = new Chair(clock);
        chair.entity.raise((eventId, at, v) ->
                new ChairEvent.Created(eventId, at, v, requireId(id, "Chair id"), validName));
        return chair;
    }

    public static Chair reconstruct(List<? extends ChairEvent> events, Clock clock) {
        Chair chair = new Chair(clock);
        chair.entity.replay(events);
        return chair;
    }

    public static Chair reconstruct(List<? extends ChairEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public void assignToProfessor(UUID professorId) {
        requireId(professorId, "Professor id");
        requireNotDeleted(this);
        require(this.professorId == null,
                BusinessRule.REFERENCE_ALREADY_SET,
                "Chair '" + name + "' is already held by " + this.professorId);
        entity.raise((eventId, at, v) -> new ChairEvent.AssignedToProfessor(eventId, at, v, id(), professorId));
    }

    public void releaseProfessor(UUID professorId) {
        requireId(professorId, "Professor id");
        requireNotDeleted(this);
        require(professorId.equals(this.professorId),
                BusinessRule.REFERENCE_MISMATCH,
                "Chair '" + name + "' is not held by " + professorId);
        entity.raise((eventId, at, v) -> new ChairEvent.ProfessorReleased(eventId, at, v, id(), professorId));
    }

    public void delete() {
        requireNotDeleted(this);
        require(professorId == null, BusinessRule.CHAIR_HELD,
                "Chair '" + name + "' is held by " + professorId);
        entity.raise((eventId, at, v) -> new ChairEvent.Deleted(eventId, at, v, id()));
    }

    private void apply(ChairEvent event) {
        switch (event.eventType()) {
            case CHAIR_CREATED -> name = ((ChairEvent.Created) event).name();
            case CHAIR_ASSIGNED_TO_PROFESSOR -> professorId = ((ChairEvent.AssignedToProfessor) event).professorId();
            case CHAIR_PROFESSOR_RELEASED -> professorId = null;
            case CHAIR_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not a chair event: " + event.eventType());
        }
    }

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.CHAIR;
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
    public List<ChairEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public String name() {
        return name;
    }

    public Optional<UUID> professorId() {
        return Optional.ofNullable(professorId);
    }

    public boolean isHeld() {
        return professorId != null;
    }

    public boolean isHeldBy(UUID candidate) {
        return candidate != null && candidate.equals(professorId);
    }
}
