package com.zeus.people.domain.event;

import java.util.Optional;

/**
 * All known event tags.
 *
 * <p>{@link #value()} is the canonical string persisted in the envelope's event type column; each
 * constant also names the record that carries its payload and the aggregate type that raises it.
 */
public enum EventType {

    // ---- Academic ----
    ACADEMIC_CREATED("AcademicCreated", AggregateType.ACADEMIC, AcademicEvent.Created.class),
    ACADEMIC_RANK_CHANGED("AcademicRankChanged", AggregateType.ACADEMIC, AcademicEvent.RankChanged.class),
    ACADEMIC_ASSIGNED_TO_DEPARTMENT(
            "AcademicAssignedToDepartment", AggregateType.ACADEMIC, AcademicEvent.AssignedToDepartment.class),
    ACADEMIC_ASSIGNED_TO_ROOM("AcademicAssignedToRoom", AggregateType.ACADEMIC, AcademicEvent.AssignedToRoom.class),
    ACADEMIC_REMOVED_FROM_ROOM("AcademicRemovedFromRoom", AggregateType.ACADEMIC, AcademicEvent.RemovedFromRoom.class),
    ACADEMIC_TENURED("AcademicTenured", AggregateType.ACADEMIC, AcademicEvent.Tenured.class),
    ACADEMIC_CONTRACT_END_DATE_SET(
            "AcademicContractEndDateSet", AggregateType.ACADEMIC, AcademicEvent.ContractEndDateSet.class),
    ACADEMIC_HOME_PHONE_SET("AcademicHomePhoneSet", AggregateType.ACADEMIC, AcademicEvent.HomePhoneSet.class),
    ACADEMIC_EXTENSION_ASSIGNED(
            "AcademicExtensionAssigned", AggregateType.ACADEMIC, AcademicEvent.ExtensionAssigned.class),
    ACADEMIC_CHAIR_ASSIGNED("AcademicChairAssigned", AggregateType.ACADEMIC, AcademicEvent.ChairAssigned.class),
    ACADEMIC_CHAIR_REMOVED("AcademicChairRemoved", AggregateType.ACADEMIC, AcademicEvent.ChairRemoved.class),
    ACADEMIC_SUBJECT_ADDED("AcademicSubjectAdded", AggregateType.ACADEMIC, AcademicEvent.SubjectAdded.class),
    ACADEMIC_SUBJECT_REMOVED("AcademicSubjectRemoved", AggregateType.ACADEMIC, AcademicEvent.SubjectRemoved.class),
    ACADEMIC_DEGREE_ADDED("AcademicDegreeAdded", AggregateType.ACADEMIC, AcademicEvent.DegreeAdded.class),
    ACADEMIC_AUDITEE_ADDED("AcademicAuditeeAdded", AggregateType.ACADEMIC, AcademicEvent.AuditeeAdded.class),
    ACADEMIC_DELETED("AcademicDeleted", AggregateType.ACADEMIC, AcademicEvent.Deleted.class),

    // ---- Department ----
    DEPARTMENT_CREATED("DepartmentCreated", AggregateType.DEPARTMENT, DepartmentEvent.Created.class),
    DEPARTMENT_BUDGETS_SET("DepartmentBudgetsSet", AggregateType.DEPARTMENT, DepartmentEvent.BudgetsSet.class),
    DEPARTMENT_ACADEMIC_ADDED(
            "DepartmentAcademicAdded", AggregateType.DEPARTMENT, DepartmentEvent.AcademicAdded.class),
    DEPARTMENT_ACADEMIC_REMOVED(
            "DepartmentAcademicRemoved", AggregateType.DEPARTMENT, DepartmentEvent.AcademicRemoved.class),
    PROFESSOR_ASSIGNED_AS_DEPARTMENT_HEAD(
            "ProfessorAssignedAsDepartmentHead", AggregateType.DEPARTMENT, DepartmentEvent.HeadAssigned.class),
    CHAIR_ASSIGNED_TO_DEPARTMENT(
            "ChairAssignedToDepartment", AggregateType.DEPARTMENT, DepartmentEvent.ChairAssigned.class),
    DEPARTMENT_DELETED("DepartmentDeleted", AggregateType.DEPARTMENT, DepartmentEvent.Deleted.class),

    // ---- Room ----
    ROOM_CREATED("RoomCreated", AggregateType.ROOM, RoomEvent.Created.class),
    ROOM_OCCUPANT_ADDED("RoomOccupantAdded", AggregateType.ROOM, RoomEvent.OccupantAdded.class),
    ROOM_OCCUPANT_REMOVED("RoomOccupantRemoved", AggregateType.ROOM, RoomEvent.OccupantRemoved.class),
    ROOM_DELETED("RoomDeleted", AggregateType.ROOM, RoomEvent.Deleted.class),

    // ---- Building ----
    BUILDING_CREATED("BuildingCreated", AggregateType.BUILDING, BuildingEvent.Created.class),
    BUILDING_ROOM_ADDED("BuildingRoomAdded", AggregateType.BUILDING, BuildingEvent.RoomAdded.class),
    BUILDING_ROOM_REMOVED("BuildingRoomRemoved", AggregateType.BUILDING, BuildingEvent.RoomRemoved.class),
    BUILDING_DELETED("BuildingDeleted", AggregateType.BUILDING, BuildingEvent.Deleted.class),

    // ---- Chair ----
    CHAIR_CREATED("ChairCreated", AggregateType.CHAIR, ChairEvent.Created.class),
    CHAIR_ASSIGNED_TO_PROFESSOR(
            "ChairAssignedToProfessor", AggregateType.CHAIR, ChairEvent.AssignedToProfessor.class),
    CHAIR_PROFESSOR_RELEASED("ChairProfessorReleased", AggregateType.CHAIR, ChairEvent.ProfessorReleased.class),
    CHAIR_DELETED("ChairDeleted", AggregateType.CHAIR, ChairEvent.Deleted.class),

    // ---- Extension ----
    EXTENSION_CREATED("ExtensionCreated", AggregateType.EXTENSION, ExtensionEvent.Created.class),
    EXTENSION_ASSIGNED_TO_ACADEMIC(
            "ExtensionAssignedToAcademic", AggregateType.EXTENSION, ExtensionEvent.AssignedToAcademic.class),
    EXTENSION_ACADEMIC_RELEASED(
            "ExtensionAcademicReleased", AggregateType.EXTENSION, ExtensionEvent.AcademicReleased.class),
    EXTENSION_DELETED("ExtensionDeleted", AggregateType.EXTENSION, ExtensionEvent.Deleted.class),

    // ---- Committee ----
    COMMITTEE_CREATED("CommitteeCreated", AggregateType.COMMITTEE, CommitteeEvent.Created.class),
    COMMITTEE_MEMBER_ADDED("CommitteeMemberAdded", AggregateType.COMMITTEE, CommitteeEvent.MemberAdded.class),
    COMMITTEE_MEMBER_REMOVED("CommitteeMemberRemoved", AggregateType.COMMITTEE, CommitteeEvent.MemberRemoved.class),
    COMMITTEE_DELETED("CommitteeDeleted", AggregateType.COMMITTEE, CommitteeEvent.Deleted.class),

    // ---- Subject ----
    SUBJECT_CREATED("SubjectCreated", AggregateType.SUBJECT, SubjectEvent.Created.class),
    SUBJECT_TEACHER_ADDED("SubjectTeacherAdded", AggregateType.SUBJECT, SubjectEvent.TeacherAdded.class),
    SUBJECT_TEACHER_REMOVED("SubjectTeacherRemoved", AggregateType.SUBJECT, SubjectEvent.TeacherRemoved.class),
    SUBJECT_TEACHING_RATED("SubjectTeachingRated", AggregateType.SUBJECT, SubjectEvent.TeachingRated.class),
    SUBJECT_DELETED("SubjectDeleted", AggregateType.SUBJECT, SubjectEvent.Deleted.class),

    // ---- Degree ----
    DEGREE_CREATED("DegreeCreated", AggregateType.DEGREE, DegreeEvent.Created.class),
    DEGREE_OBTAINED("DegreeObtained", AggregateType.DEGREE, DegreeEvent.Obtained.class),
    DEGREE_OBTAINMENT_REMOVED(
            "DegreeObtainmentRemoved", AggregateType.DEGREE, DegreeEvent.ObtainmentRemoved.class),
    DEGREE_DELETED("DegreeDeleted", AggregateType.DEGREE, DegreeEvent.Deleted.class),

    // ---- University ----
    UNIVERSITY_CREATED("UniversityCreated", AggregateType.UNIVERSITY, UniversityEvent.Created.class),
    UNIVERSITY_DEGREE_ADDED("UniversityDegreeAdded", AggregateType.UNIVERSITY, UniversityEvent.DegreeAdded.class),
    UNIVERSITY_DEGREE_REMOVED(
            "UniversityDegreeRemoved", AggregateType.UNIVERSITY, UniversityEvent.DegreeRemoved.class),
    UNIVERSITY_DELETED("UniversityDeleted", AggregateType.UNIVERSITY, UniversityEvent.Deleted.class);

    private final String value;
    private final AggregateType aggregateType;
    private final Class<? extends DomainEvent> eventClass;

    EventType(String value, AggregateType aggregateType, Class<? extends DomainEvent> eventClass) {
        this.value = value;
        this.aggregateType = aggregateType;
        this.eventClass = eventClass;
    }

    /** The canonical tag (e.g. "AcademicCreated"). */
    public String value() {
        return value;
    }

    /** The aggregate type that raises events of this type. */
    public AggregateType aggregateType() {
        return aggregateType;
    }

    /** The record carrying this event's payload. */
    public Class<? extends DomainEvent> eventClass() {
        return eventClass;
    }

    /**
     * Looks up an EventType by its canonical tag.
     *
     * @param value the tag to match (e.g. "AcademicCreated")
     * @return the matching EventType, or empty if the tag is unknown
     */
    public static Optional<EventType> fromTag(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string is a known event tag. */
    public static boolean isKnown(String value) {
        return fromTag(value).isPresent();
    }
}
