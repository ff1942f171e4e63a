package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.CommitteeEvent;
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

/** A committee on which teaching professors serve. */
public final class Committee implements AggregateRoot<CommitteeEvent> {

    static final int MAX_NAME_LENGTH = 100;

    private final EventSourcedEntity<CommitteeEvent> entity;

    private String name;
    private final Set<UUID> memberIds = new LinkedHashSet<>();
    private boolean deleted;

    private Committee(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static Committee create(String name, Clock clock) {
        return create(UUID.randomUUID(), name, clock);
    }

    public static Committee create(UUID id, String name, Clock clock) {
        String validName = requireName(name, "Committee name", MAX_NAME_LENGTH);
        Committee committee = new Committee(clock);
        committee.entity.raise((eventId, at, v) ->
                new CommitteeEvent.Created(eventId, at, v, requireId(id, "Committee id"), validName));
        return committee;
    }

    public static Committee reconstruct(List<? extends CommitteeEvent> events, Clock clock) {
        Committee committee = new Committee(clock);
        committee.entity.replay(events);
        return committee;
    }

    public static Committee reconstruct(List<? extends CommitteeEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public void addMember(UUID professorId) {
        requireId(professorId, "Professor id");
        requireNotDeleted(this);
        require(!memberIds.contains(professorId),
                BusinessRule.DUPLICATE_ASSOCIATION,
                "Professor " + professorId + " already serves on committee '" + name + "'");
        entity.raise((eventId, at, v) -> new CommitteeEvent.MemberAdded(eventId, at, v, id(), professorId));
    }

    public void removeMember(UUID professorId) {
        requireId(professorId, "Professor id");
        requireNotDeleted(this);
        require(memberIds.contains(professorId),
                BusinessRule.UNKNOWN_ASSOCIATION,
                "Professor " + professorId + " does not serve on committee '" + name + "'");
        entity.raise((eventId, at, v) -> new CommitteeEvent.MemberRemoved(eventId, at, v, id(), professorId));
    }

    public void delete() {
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new CommitteeEvent.Deleted(eventId, at, v, id()));
    }

    private void apply(CommitteeEvent event) {
        switch (event.eventType()) {
            case COMMITTEE_CREATED -> name = ((CommitteeEvent.Created) event).name();
            case COMMITTEE_MEMBER_ADDED -> memberIds.add(((CommitteeEvent.MemberAdded) event).professorId());
            case COMMITTEE_MEMBER_REMOVED -> memberIds.remove(((CommitteeEvent.MemberRemoved) event).professorId());
            case COMMITTEE_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not a committee event: " + event.eventType());
        }
    }

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.COMMITTEE;
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
    public List<CommitteeEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public String name() {
        return name;
    }

    public Set<UUID> memberIds() {
        return Collections.unmodifiableSet(memberIds);
    }
}
