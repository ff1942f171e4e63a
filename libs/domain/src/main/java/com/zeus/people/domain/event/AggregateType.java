package com.zeus.people.domain.event;

import java.util.Optional;

/** All aggregate types whose state is recorded in the event log. */
public enum AggregateType {
    ACADEMIC("Academic", AcademicEvent.class),
    DEPARTMENT("Department", DepartmentEvent.class),
    ROOM("Room", RoomEvent.class),
    BUILDING("Building", BuildingEvent.class),
    CHAIR("Chair", ChairEvent.class),
    EXTENSION("Extension", ExtensionEvent.class),
    COMMITTEE("Committee", CommitteeEvent.class),
    SUBJECT("Subject", SubjectEvent.class),
    DEGREE("Degree", DegreeEvent.class),
    UNIVERSITY("University", UniversityEvent.class);

    private final String value;
    private final Class<? extends DomainEvent> eventFamily;

    AggregateType(String value, Class<? extends DomainEvent> eventFamily) {
        this.value = value;
        this.eventFamily = eventFamily;
    }

    /** Canonical name, stored in the envelope's aggregate type column. */
    public String value() {
        return value;
    }

    /** The sealed event family raised by aggregates of this type. */
    public Class<? extends DomainEvent> eventFamily() {
        return eventFamily;
    }

    public static Optional<AggregateType> fromString(String value) {
        for (AggregateType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
