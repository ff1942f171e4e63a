package com.zeus.people.service.repository;

import com.zeus.people.domain.aggregate.Academic;
import com.zeus.people.domain.aggregate.AggregateRoot;
import com.zeus.people.domain.aggregate.Building;
import com.zeus.people.domain.aggregate.Chair;
import com.zeus.people.domain.aggregate.Committee;
import com.zeus.people.domain.aggregate.Degree;
import com.zeus.people.domain.aggregate.Department;
import com.zeus.people.domain.aggregate.Extension;
import com.zeus.people.domain.aggregate.Room;
import com.zeus.people.domain.aggregate.Subject;
import com.zeus.people.domain.aggregate.University;
import com.zeus.people.domain.event.AcademicEvent;
import com.zeus.people.domain.event.AggregateType;
import com.zeus.people.domain.event.BuildingEvent;
import com.zeus.people.domain.event.ChairEvent;
import com.zeus.people.domain.event.CommitteeEvent;
import com.zeus.people.domain.event.DegreeEvent;
import com.zeus.people.domain.event.DepartmentEvent;
import com.zeus.people.domain.event.DomainEvent;
import com.zeus.people.domain.event.ExtensionEvent;
import com.zeus.people.domain.event.RoomEvent;
import com.zeus.people.domain.event.SubjectEvent;
import com.zeus.people.domain.event.UniversityEvent;
import com.zeus.people.eventstore.ClaimSet;
import com.zeus.people.eventstore.codec.EventDecodingException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Everything a generic repository or projection needs to know about one aggregate type.
 *
 * @param type the aggregate type, stored with every envelope
 * @param eventFamily the sealed family every event of the stream must belong to
 * @param reconstruct rebuilds an aggregate from its full, version-ordered history
 * @param deletion the domain operation that deletes an aggregate
 * @param claimPolicy uniqueness claims taken or released together with an append
 */
public record AggregateDefinition<A extends AggregateRoot<E>, E extends DomainEvent>(
        AggregateType type,
        Class<E> eventFamily,
        BiFunction<List<E>, Clock, A> reconstruct,
        Consumer<A> deletion,
        UniqueClaimPolicy<A, E> claimPolicy) {

    public AggregateDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(eventFamily, "eventFamily");
        Objects.requireNonNull(reconstruct, "reconstruct");
        Objects.requireNonNull(deletion, "deletion");
        Objects.requireNonNull(claimPolicy, "claimPolicy");
        if (!type.eventFamily().equals(eventFamily)) {
            throw new IllegalArgumentException(type.value() + " raises " + type.eventFamily().getSimpleName()
                    + ", not " + eventFamily.getSimpleName());
        }
    }

    /**
     * Narrows a decoded stream to this type's event family.
     *
     * @throws EventDecodingException if the stream holds an event of another family
     */
    public List<E> narrow(List<DomainEvent> events) {
        var narrowed = new ArrayList<E>(events.size());
        for (DomainEvent event : events) {
            if (!eventFamily.isInstance(event)) {
                throw new EventDecodingException(event.eventType().value(),
                        "Stream " + event.aggregateId() + " of type " + type.value()
                                + " contains " + event.eventType().value());
            }
            narrowed.add(eventFamily.cast(event));
        }
        return narrowed;
    }

    public A reconstruct(List<E> events, Clock clock) {
        return reconstruct.apply(events, clock);
    }

    public static AggregateDefinition<Academic, AcademicEvent> academic() {
        return new AggregateDefinition<>(AggregateType.ACADEMIC, AcademicEvent.class,
                Academic::reconstruct, Academic::delete, UniqueClaimPolicy.none());
    }

    public static AggregateDefinition<Department, DepartmentEvent> department() {
        return new AggregateDefinition<>(AggregateType.DEPARTMENT, DepartmentEvent.class,
                Department::reconstruct, Department::delete, UniqueClaimPolicy.none());
    }

    /** Rooms hold their building-qualified room number from creation until deletion. */
    public static AggregateDefinition<Room, RoomEvent> room() {
        return new AggregateDefinition<>(AggregateType.ROOM, RoomEvent.class,
                Room::reconstruct, Room::delete, AggregateDefinition::roomClaims);
    }

    public static AggregateDefinition<Building, BuildingEvent> building() {
        return new AggregateDefinition<>(AggregateType.BUILDING, BuildingEvent.class,
                Building::reconstruct, Building::delete, UniqueClaimPolicy.none());
    }

    /** A chair holds its professor's claim while assigned, so no professor holds two chairs. */
    public static AggregateDefinition<Chair, ChairEvent> chair() {
        return new AggregateDefinition<>(AggregateType.CHAIR, ChairEvent.class,
                Chair::reconstruct, Chair::delete, AggregateDefinition::chairClaims);
    }

    public static AggregateDefinition<Extension, ExtensionEvent> extension() {
        return new AggregateDefinition<>(AggregateType.EXTENSION, ExtensionEvent.class,
                Extension::reconstruct, Extension::delete, UniqueClaimPolicy.none());
    }

    public static AggregateDefinition<Committee, CommitteeEvent> committee() {
        return new AggregateDefinition<>(AggregateType.COMMITTEE, CommitteeEvent.class,
                Committee::reconstruct, Committee::delete, UniqueClaimPolicy.none());
    }

    public static AggregateDefinition<Subject, SubjectEvent> subject() {
        return new AggregateDefinition<>(AggregateType.SUBJECT, SubjectEvent.class,
                Subject::reconstruct, Subject::delete, UniqueClaimPolicy.none());
    }

    public static AggregateDefinition<Degree, DegreeEvent> degree() {
        return new AggregateDefinition<>(AggregateType.DEGREE, DegreeEvent.class,
                Degree::reconstruct, Degree::delete, UniqueClaimPolicy.none());
    }

    public static AggregateDefinition<University, UniversityEvent> university() {
        return new AggregateDefinition<>(AggregateType.UNIVERSITY, UniversityEvent.class,
                University::reconstruct, University::delete, UniqueClaimPolicy.none());
    }

    private static ClaimSet roomClaims(Room room, List<RoomEvent> pending) {
        ClaimSet claims = ClaimSet.none();
        for (RoomEvent event : pending) {
            switch (event.eventType()) {
                case ROOM_CREATED -> {
                    var created = (RoomEvent.Created) event;
                    claims = claims.and(ClaimSet.acquiring(ClaimKeys.roomNumber(created.buildingId(), created.roomNr())));
                }
                case ROOM_DELETED -> claims = claims.and(
                        ClaimSet.releasing(ClaimKeys.roomNumber(room.buildingId(), room.roomNr())));
                default -> {
                    // occupancy does not touch the room number
                }
            }
        }
        return claims;
    }

    private static ClaimSet chairClaims(Chair chair, List<ChairEvent> pending) {
        ClaimSet claims = ClaimSet.none();
        for (ChairEvent event : pending) {
            switch (event.eventType()) {
                case CHAIR_ASSIGNED_TO_PROFESSOR -> claims = claims.and(ClaimSet.acquiring(
                        ClaimKeys.chairHolder(((ChairEvent.AssignedToProfessor) event).professorId())));
                case CHAIR_PROFESSOR_RELEASED -> claims = claims.and(ClaimSet.releasing(
                        ClaimKeys.chairHolder(((ChairEvent.ProfessorReleased) event).professorId())));
                default -> {
                    // creation and deletion carry no holder
                }
            }
        }
        return claims;
    }
}
