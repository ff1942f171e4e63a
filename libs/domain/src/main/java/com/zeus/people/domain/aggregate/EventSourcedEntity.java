package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.event.DomainEvent;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Event-sourcing capability owned by every aggregate: version tracking, timestamps and the
 * uncommitted event list.
 *
 * <p>The owning aggregate supplies its {@code apply} function; the entity calls it for raised and
 * replayed events alike, so state can only change through an event. Replay never touches the
 * clock: timestamps come from the events' {@code occurredAt}.
 *
 * @param <E> the owning aggregate's event family
 */
public final class EventSourcedEntity<E extends DomainEvent> {

    /** Builds the next event from the header fields the entity assigns. */
    @FunctionalInterface
    public interface EventFactory<T> {
        T create(UUID eventId, Instant occurredAt, int version);
    }

    private final Consumer<E> applier;
    private final Clock clock;
    private final List<E> uncommitted = new ArrayList<>();

    private UUID id;
    private Instant createdAt;
    private Instant modifiedAt;
    private int version;

    public EventSourcedEntity(Consumer<E> applier, Clock clock) {
        this.applier = Objects.requireNonNull(applier, "applier");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the next event with a fresh id, the clock's current instant and the next version,
     * applies it and records it as uncommitted. The instant is cut to microseconds, the finest
     * unit the event log keeps.
     */
    public <T extends E> T raise(EventFactory<T> factory) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        T event = factory.create(UUID.randomUUID(), now, version + 1);
        track(event);
        uncommitted.add(event);
        return event;
    }

    /**
     * Folds historical events into the aggregate without recording them as uncommitted.
     *
     * @throws IllegalStateException if a version is out of order or the stream mixes aggregates
     */
    public void replay(List<? extends E> events) {
        for (E event : events) {
            track(event);
        }
    }

    private void track(E event) {
        Objects.requireNonNull(event, "event");
        if (event.version() != version + 1) {
            throw new IllegalStateException(
                    "Event " + event.eventType().value() + " has version " + event.version()
                            + " but version " + (version + 1) + " was expected");
        }
        if (id == null) {
            id = event.aggregateId();
            createdAt = event.occurredAt();
        } else if (!id.equals(event.aggregateId())) {
            throw new IllegalStateException(
                    "Event belongs to aggregate " + event.aggregateId() + ", not " + id);
        }
        applier.accept(event);
        version = event.version();
        modifiedAt = event.occurredAt();
    }

    public UUID id() {
        return id;
    }

    public int version() {
        return version;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant modifiedAt() {
        return modifiedAt;
    }

    public List<E> uncommittedEvents() {
        return List.copyOf(uncommitted);
    }

    public void markCommitted() {
        uncommitted.clear();
    }
}
