package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.UniversityEvent;
import com.zeus.people.domain.rules.BusinessRule;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.zeus.people.domain.aggregate.Invariants.require;
import static com.zeus.people.domain.aggregate.Invariants.requireId;
import static com.zeus.people.domain.aggregate.Invariants.requireName;
import static com.zeus.people.domain.aggregate.Invariants.requireNotDeleted;

/** An institution awarding degrees. */
public final class University implements AggregateRoot<UniversityEvent> {

    static final int MAX_CODE_LENGTH = 20;

    private final EventSourcedEntity<UniversityEvent> entity;

    private String code;
    private final Set<UUID> degreeIds = new LinkedHashSet<>();
    private boolean deleted;

    private University(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static University create(String code, Clock clock) {
        return create(UUID.randomUUID(), code, clock);
    }

    public static University create(UUID id, String code, Clock clock) {
        String validCode = requireName(code, "University code", MAX_CODE_LENGTH);
        University university = new University(clock);
        university.entity.raise((eventId, at, v) ->
                new UniversityEvent.Created(eventId, at, v, requireId(id, "University id"), validCode));
        return university;
    }

    public static University reconstruct(List<? extends UniversityEvent> events, Clock clock) {
        University university = new University(clock);
        university.entity.replay(events);
        return university;
    }

    public static University reconstruct(List<? extends UniversityEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public void addDegree(UUID degreeId) {
        requireId(degreeId, "Degree id");
        requireNotDeleted(this);
        require(!degreeIds.contains(degreeId),
                BusinessRule.DUPLICATE_ASSOCIATION,
                "University '" + code + "' already awards degree " + degreeId);
        entity.raise((eventId, at, v) -> new UniversityEvent.DegreeAdded(eventId, at, v, id(), degreeId));
    }

    public void removeDegree(UUID degreeId) {
        requireId(degreeId, "Degree id");
        requireNotDeleted(this);
        require(degreeIds.contains(degreeId),
                BusinessRule.UNKNOWN_ASSOCIATION,
                "University '" + code + "' does not award degree " + degreeId);
        entity.raise((eventId, at, v) -> new UniversityEvent.DegreeRemoved(eventId, at, v, id(), degreeId));
    }

    public void delete() {
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new UniversityEvent.Deleted(eventId, at, v, id()));
    }

    private void apply(UniversityEvent event) {
        switch (event.eventType()) {
            case UNIVERSITY_CREATED -> code = ((UniversityEvent.Created) event).code();
            case UNIVERSITY_DEGREE_ADDED -> degreeIds.add(((UniversityEvent.DegreeAdded) event).degreeId());
            case UNIVERSITY_DEGREE_REMOVED -> degreeIds.remove(((UniversityEvent.DegreeRemoved) event).degreeId());
            case UNIVERSITY_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not a university event: " + event.eventType());
        }
    }

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.UNIVERSITY;
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
    public List<UniversityEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public String code() {
        return code;
    }

    public Set<UUID> degreeIds() {
        return Collections.unmodifiableSet(degreeIds);
    }

    public boolean awards(UUID degreeId) {
        return degreeIds.contains(degreeId);
    }
}
