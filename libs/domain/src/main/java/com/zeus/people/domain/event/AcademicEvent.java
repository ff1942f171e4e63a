package com.zeus.people.domain.event;

import com.zeus.people.domain.valueobject.EmpName;
import com.zeus.people.domain.valueobject.EmpNr;
import com.zeus.people.domain.valueobject.PhoneNr;
import com.zeus.people.domain.valueobject.Rank;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Events raised by the {@code Academic} aggregate. */
public sealed interface AcademicEvent extends DomainEvent {

    UUID academicId();

    @Override
    default UUID aggregateId() {
        return academicId();
    }

    record Created(
            UUID eventId,
            Instant occurredAt,
            int version,
            UUID academicId,
            EmpNr empNr,
            EmpName empName,
            Rank rank)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_CREATED;
        }
    }

    record RankChanged(
            UUID eventId, Instant occurredAt, int version, UUID academicId, Rank oldRank, Rank newRank)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_RANK_CHANGED;
        }
    }

    record AssignedToDepartment(
            UUID eventId, Instant occurredAt, int version, UUID academicId, UUID departmentId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_ASSIGNED_TO_DEPARTMENT;
        }
    }

    record AssignedToRoom(UUID eventId, Instant occurredAt, int version, UUID academicId, UUID roomId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_ASSIGNED_TO_ROOM;
        }
    }

    record RemovedFromRoom(UUID eventId, Instant occurredAt, int version, UUID academicId, UUID roomId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_REMOVED_FROM_ROOM;
        }
    }

    record Tenured(UUID eventId, Instant occurredAt, int version, UUID academicId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_TENURED;
        }
    }

    record ContractEndDateSet(
            UUID eventId, Instant occurredAt, int version, UUID academicId, LocalDate contractEndDate)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_CONTRACT_END_DATE_SET;
        }
    }

    record HomePhoneSet(UUID eventId, Instant occurredAt, int version, UUID academicId, PhoneNr homePhone)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_HOME_PHONE_SET;
        }
    }

    record ExtensionAssigned(
            UUID eventId, Instant occurredAt, int version, UUID academicId, UUID extensionId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_EXTENSION_ASSIGNED;
        }
    }

    record ChairAssigned(UUID eventId, Instant occurredAt, int version, UUID academicId, UUID chairId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_CHAIR_ASSIGNED;
        }
    }

    record ChairRemoved(UUID eventId, Instant occurredAt, int version, UUID academicId, UUID chairId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_CHAIR_REMOVED;
        }
    }

    record SubjectAdded(UUID eventId, Instant occurredAt, int version, UUID academicId, UUID subjectId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_SUBJECT_ADDED;
        }
    }

    record SubjectRemoved(UUID eventId, Instant occurredAt, int version, UUID academicId, UUID subjectId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_SUBJECT_REMOVED;
        }
    }

    record DegreeAdded(UUID eventId, Instant occurredAt, int version, UUID academicId, UUID degreeId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_DEGREE_ADDED;
        }
    }

    /** The academic started auditing the teaching of {@code auditeeId}. */
    record AuditeeAdded(UUID eventId, Instant occurredAt, int version, UUID academicId, UUID auditeeId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_AUDITEE_ADDED;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID academicId)
            implements AcademicEvent {
        @Override
        public EventType eventType() {
            return EventType.ACADEMIC_DELETED;
        }
    }
}
