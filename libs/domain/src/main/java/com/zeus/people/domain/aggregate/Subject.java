package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.SubjectEvent;
import com.zeus.people.domain.rules.BusinessRule;
import com.zeus.people.domain.valueobject.Rating;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.zeus.people.domain.aggregate.Invariants.require;
import static com.zeus.people.domain.aggregate.Invariants.requireId;
import static com.zeus.people.domain.aggregate.Invariants.requireName;
import static com.zeus.people.domain.aggregate.Invariants.requireNotDeleted;

/**
 * A subject taught by academics. Each teaching may carry a rating from 1 to 7; removing a teacher
 * drops the teacher's rating.
 */
public final class Subject implements AggregateRoot<SubjectEvent> {

    static final int MAX_CODE_LENGTH = 20;

    private final EventSourcedEntity<SubjectEvent> entity;

    private String code;
    // teacher -> rating, null until rated
    private final Map<UUID, Rating> teachings = new LinkedHashMap<>();
    private boolean deleted;

    private Subject(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static Subject create(String code, Clock clock) {
        return create(UUID.randomUUID(), code, clock);
    }

    public static Subject create(UUID id, String code, Clock clock) {
        String validCode = requireName(code, "Subject code", MAX_CODE_LENGTH);
        Subject subject = new Subject(clock);
        subject.entity.raise((eventId, at, v) ->
                new SubjectEvent.Created(eventId, at, v, requireId(id, "Subject id"), validCode));
        return subject;
    }

    public static Subject reconstruct(List<? extends SubjectEvent> events, Clock clock) {
        Subject subject = new Subject(clock);
        subject.entity.replay(events);
        return subject;
    }

    public static Subject reconstruct(List<? extends SubjectEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public void addTeacher(UUID academicId) {
        requireId(academicId, "Academic id");
        requireNotDeleted(this);
        require(!teachings.containsKey(academicId),
                BusinessRule.DUPLICATE_ASSOCIATION,
                "Academic " + academicId + " already teaches " + code);
        entity.raise((eventId, at, v) -> new SubjectEvent.TeacherAdded(eventId, at, v, id(), academicId));
    }

    public void removeTeacher(UUID academicId) {
        requireId(academicId, "Academic id");
        requireNotDeleted(this);
        require(teachings.containsKey(academicId),
                BusinessRule.UNKNOWN_ASSOCIATION,
                "Academic " + academicId + " does not teach " + code);
        entity.raise((eventId, at, v) -> new SubjectEvent.TeacherRemoved(eventId, at, v, id(), academicId));
    }

    public void rateTeaching(UUID academicId, Rating rating) {
        requireId(academicId, "Academic id");
        Objects.requireNonNull(rating, "rating");
        requireNotDeleted(this);
        require(teachings.containsKey(academicId),
                BusinessRule.RATING_REQUIRES_TEACHER,
                "Academic " + academicId + " does not teach " + code);
        entity.raise((eventId, at, v) -> new SubjectEvent.TeachingRated(eventId, at, v, id(), academicId, rating));
    }

    public void delete() {
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new SubjectEvent.Deleted(eventId, at, v, id()));
    }

    private void apply(SubjectEvent event) {
        switch (event.eventType()) {
            case SUBJECT_CREATED -> code = ((SubjectEvent.Created) event).code();
            case SUBJECT_TEACHER_ADDED -> teachings.put(((SubjectEvent.TeacherAdded) event).academicId(), null);
            case SUBJECT_TEACHER_REMOVED -> teachings.remove(((SubjectEvent.TeacherRemoved) event).academicId());
            case SUBJECT_TEACHING_RATED -> {
                var e = (SubjectEvent.TeachingRated) event;
                teachings.put(e.academicId(), e.rating());
            }
            case SUBJECT_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not a subject event: " + event.eventType());
        }
    }

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.SUBJECT;
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
    public List<SubjectEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public String code() {
        return code;
    }

    public Set<UUID> teacherIds() {
        return Collections.unmodifiableSet(teachings.keySet());
    }

    public Optional<Rating> ratingOf(UUID academicId) {
        return Optional.ofNullable(teachings.get(academicId));
    }
}
