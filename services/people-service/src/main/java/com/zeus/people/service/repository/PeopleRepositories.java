package com.zeus.people.service.repository;

import com.zeus.people.domain.aggregate.Academic;
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
import com.zeus.people.domain.event.BuildingEvent;
import com.zeus.people.domain.event.ChairEvent;
import com.zeus.people.domain.event.CommitteeEvent;
import com.zeus.people.domain.event.DegreeEvent;
import com.zeus.people.domain.event.DepartmentEvent;
import com.zeus.people.domain.event.ExtensionEvent;
import com.zeus.people.domain.event.RoomEvent;
import com.zeus.people.domain.event.SubjectEvent;
import com.zeus.people.domain.event.UniversityEvent;
import com.zeus.people.eventstore.EventStore;
import com.zeus.people.eventstore.publish.EventPublisher;

import java.time.Clock;

/** One write repository per aggregate type, all over the same store. */
public record PeopleRepositories(
        EventSourcedRepository<Academic, AcademicEvent> academics,
        EventSourcedRepository<Department, DepartmentEvent> departments,
        EventSourcedRepository<Room, RoomEvent> rooms,
        EventSourcedRepository<Building, BuildingEvent> buildings,
        EventSourcedRepository<Chair, ChairEvent> chairs,
        EventSourcedRepository<Extension, ExtensionEvent> extensions,
        EventSourcedRepository<Committee, CommitteeEvent> committees,
        EventSourcedRepository<Subject, SubjectEvent> subjects,
        EventSourcedRepository<Degree, DegreeEvent> degrees,
        EventSourcedRepository<University, UniversityEvent> universities) {

    public static PeopleRepositories over(EventStore store, EventPublisher publisher, Clock clock, int maxAttempts) {
        return new PeopleRepositories(
                new EventSourcedRepository<>(store, AggregateDefinition.academic(), publisher, clock, maxAttempts),
                new EventSourcedRepository<>(store, AggregateDefinition.department(), publisher, clock, maxAttempts),
                new EventSourcedRepository<>(store, AggregateDefinition.room(), publisher, clock, maxAttempts),
                new EventSourcedRepository<>(store, AggregateDefinition.building(), publisher, clock, maxAttempts),
                new EventSourcedRepository<>(store, AggregateDefinition.chair(), publisher, clock, maxAttempts),
                new EventSourcedRepository<>(store, AggregateDefinition.extension(), publisher, clock, maxAttempts),
                new EventSourcedRepository<>(store, AggregateDefinition.committee(), publisher, clock, maxAttempts),
                new EventSourcedRepository<>(store, AggregateDefinition.subject(), publisher, clock, maxAttempts),
                new EventSourcedRepository<>(store, AggregateDefinition.degree(), publisher, clock, maxAttempts),
                new EventSourcedRepository<>(store, AggregateDefinition.university(), publisher, clock, maxAttempts));
    }
}
