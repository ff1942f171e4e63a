package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.ExtensionEvent;
import com.zeus.people.domain.rules.BusinessRule;
import com.zeus.people.domain.valueobject.AccessLevel;
import com.zeus.people.domain.valueobject.ExtNr;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import static com.zeus.people.domain.aggregate.Invariants.require;
import static com.zeus.people.domain.aggregate.Invariants.requireId;
import static com.zeus.people.domain.aggregate.Invariants.requireNotDeleted;

/** A telephone extension, used by one academic at a time. */
public final class Extension implements AggregateRoot<ExtensionEvent> {

    private final EventSourcedEntity<ExtensionEvent> entity;

    private ExtNr extNr;
    private UUID academicId;
    private boolean deleted;

    private Extension(Clock clock) {
        this.entity = new EventSourcedEntity<>(this::apply, clock);
    }

    public static Extension create(ExtNr extNr, Clock clock) {
        return create(UUID.randomUUID(), extNr, clock);
    }

    public static Extension create(UUID id, ExtNr extNr, Clock clock) {
        Objects.requireNonNull(extNr, "extNr");
        Extension extension = new Extension(clock);
        extension.entity.raise((eventId, at, v) ->
                new ExtensionEvent.Created(eventId, at, v, requireId(id, "Extension id"), extNr));
        return extension;
    }

    public static Extension reconstruct(List<? extends ExtensionEvent> events, Clock clock) {
        Extension extension = new Extension(clock);
        extension.entity.replay(events);
        return extension;
    }

    public static Extension reconstruct(List<? extends ExtensionEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public void assignToAcademic(UUID academicId) {
        requireId(academicId, "Academic id");
        requireNotDeleted(this);
        require(this.academicId == null,
                BusinessRule.REFERENCE_ALREADY_SET,
                "Extension " + extNr + " is already used by " + this.academicId);
        entity.raise((eventId, at, v) -> new ExtensionEvent.AssignedToAcademic(eventId, at, v, id(), academicId));
    }

    public void releaseAcademic(UUID academicId) {
        requireId(academicId, "Academic id");
        requireNotDeleted(this);
        require(academicId.equals(this.academicId),
                BusinessRule.REFERENCE_MISMATCH,
                "Extension " + extNr + " is not used by " + academicId);
        entity.raise((eventId, at, v) -> new ExtensionEvent.AcademicReleased(eventId, at, v, id(), academicId));
    }

    public void delete() {
        requireNotDeleted(this);
        entity.raise((eventId, at, v) -> new ExtensionEvent.Deleted(eventId, at, v, id()));
    }

    /**
     * The access level this extension provides, derived from the rank of the academic using it.
     *
     * @throws IllegalArgumentException if {@code holder} is not the academic using the extension
     */
    public AccessLevel providedAccessLevel(Academic holder) {
        Objects.requireNonNull(holder, "holder");
        if (!holder.id().equals(academicId)) {
            throw new IllegalArgumentException(
                    "Extension " + extNr + " is not used by academic " + holder.id());
        }
        return holder.ensuredAccessLevel();
    }

    private void apply(ExtensionEvent event) {
        switch (event.eventType()) {
            case EXTENSION_CREATED -> extNr = ((ExtensionEvent.Created) event).extNr();
            case EXTENSION_ASSIGNED_TO_ACADEMIC ->
                    academicId = ((ExtensionEvent.AssignedToAcademic) event).academicId();
            case EXTENSION_ACADEMIC_RELEASED -> academicId = null;
            case EXTENSION_DELETED -> deleted = true;
            default -> throw new IllegalStateException("Not an extension event: " + event.eventType());
        }
    }

    @Override
    public UUID id() {
        return entity.id();
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.EXTENSION;
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
    public List<ExtensionEvent> uncommittedEvents() {
        return entity.uncommittedEvents();
    }

    @Override
    public void markEventsAsCommitted() {
        entity.markCommitted();
    }

    public ExtNr extNr() {
        return extNr;
    }

    public Optional<UUID> academicId() {
        return Optional.ofNullable(academicId);
    }
}
