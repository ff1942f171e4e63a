package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.DegreeEvent;
import com.zeus.people.domain.rules.BusinessRule;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.zeus.people.domain.aggregate.Invariants.require;
import static com.zeus.people.domain.aggregate.Invariants.requireId;
import static com.zeus.people.domain.aggregate.Invariants.requireName;
import static com.zeus.people.domain.aggregate.Invariants.requireNotDeleted;

/**
 * An academic qualification, together with who obtained it and where. An academic obtains a degree
 * from at most one university.
 */
public final class Degree implements AggregateRoot<DegreeEvent> {

    static final int MAX_CODE_LENGTH = 10;

    private final EventSourcedEntity<DegreeEvent> entity;

    private String code;
    // academic -> university the degree was obtained from
    private final Map<UUID, UUID> obtainments = new LinkedHashMap<>();
    private boolean deleted;

    private Degree(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static Degree create(String code, Clock clock) {
        return create(UUID.randomUUID(), code, clock);
    }

    public static Degree create(UUID id, String code, Clock clock) {
        String validCode = requireName(code, "Degree code", MAX_CODE_LENGTH);
        Degree degree = new Degree(clock);
        degree.entity.raise((eventId, at, v) ->
                new DegreeEvent.Created(eventId, at, v, requireId(id, "Degree id"), validCode));
        return degree;
    }

    public static Degree reconstruct(List<? extends DegreeEvent> events, Clock clock) {
        Degree degree = new Degree(clock);
        degree.entity.replay(events);
        return degree;
    }

    public static Degree reconstruct(List<? extends DegreeEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public void addObtainment(UUID academicId, UUID universityId) {
        requireId(academicId, "Academic id");
        requireId(universityId, "University id");
        requireNotDeleted(this);
        UUID existing = obtainments.get(academicId);
        require(existing == null,
                BusinessRule.DEGREE_FROM_ONE_UNIVERSITY,
                "Academic " + academicId + " already obtained degree '" + code + "' from university " + existing);
        entity.raise((eventId, at, v) -> new DegreeEvent.Obtained(eventId, at, v, id(), academicId, universityId));
    }

    public void removeObtainment(UUID academicId) {
        requireId(academicId, "Academic id");
        requireNotDeleted(this);
        require(obtainments.containsKey(academicId),
                BusinessRule.UNKNOWN_ASSOCIATION,
                "Academic " + academicId + " has not obtained degree '" + code + "'");
        entity.raise((eventId, at, v) -> new DegreeEvent.ObtainmentRemoved(eventId, at, v, id(), academicId));
    }

    public void delete() {
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new DegreeEvent.Deleted(eventId, at, v, id()));
    }

    private void apply(DegreeEvent event) {
        switch (event.eventType()) {
            case DEGREE_CREATED -> code = ((DegreeEvent.Created) event).code();
            case DEGREE_OBTAINED -> {
                var obtained = (DegreeEvent.Obtained) event;
                obtainments.put(obtained.academicId(), obtained.universityId());
            }
            case DEGREE_OBTAINMENT_REMOVED -> obtainments.remove(((DegreeEvent.ObtainmentRemoved) event).academicId());
            case DEGREE_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not a degree event: " + event.eventType());
        }
    }

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.DEGREE;
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
    public List<DegreeEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public String code() {
        return code;
    }

    /** Academic id to the university the degree was obtained from. */
    public Map<UUID, UUID> obtainments() {
        return Collections.unmodifiableMap(obtainments);
    }

    public Optional<UUID> universityOf(UUID academicId) {
        return Optional.ofNullable(obtainments.get(academicId));
    }
}
