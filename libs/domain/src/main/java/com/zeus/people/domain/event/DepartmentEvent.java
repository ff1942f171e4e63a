package com.zeus.people.domain.event;

import com.zeus.people.domain.valueobject.MoneyAmt;
import com.zeus.people.domain.valueobject.PhoneNr;

import java.time.Instant;
import java.util.UUID;

/** Events raised by the {@code Department} aggregate. */
public sealed interface DepartmentEvent extends DomainEvent {

    UUID departmentId();

    @Override
    default UUID aggregateId() {
        return departmentId();
    }

    record Created(UUID eventId, Instant occurredAt, int version, UUID departmentId, String name)
            implements DepartmentEvent {
        @Override
        public EventType eventType() {
            return EventType.DEPARTMENT_CREATED;
        }
    }

    record BudgetsSet(
            UUID eventId,
            Instant occurredAt,
            int version,
            UUID departmentId,
            MoneyAmt researchBudget,
            MoneyAmt teachingBudget)
            implements DepartmentEvent {
        @Override
        public EventType eventType() {
            return EventType.DEPARTMENT_BUDGETS_SET;
        }
    }

    record AcademicAdded(UUID eventId, Instant occurredAt, int version, UUID departmentId, UUID academicId)
            implements DepartmentEvent {
        @Override
        public EventType eventType() {
            return EventType.DEPARTMENT_ACADEMIC_ADDED;
        }
    }

    record AcademicRemoved(
            UUID eventId, Instant occurredAt, int version, UUID departmentId, UUID academicId)
            implements DepartmentEvent {
        @Override
        public EventType eventType() {
            return EventType.DEPARTMENT_ACADEMIC_REMOVED;
        }
    }

    record HeadAssigned(
            UUID eventId,
            Instant occurredAt,
            int version,
            UUID departmentId,
            UUID professorId,
            PhoneNr headHomePhone)
            implements DepartmentEvent {
        @Override
        public EventType eventType() {
            return EventType.PROFESSOR_ASSIGNED_AS_DEPARTMENT_HEAD;
        }
    }

    record ChairAssigned(UUID eventId, Instant occurredAt, int version, UUID departmentId, UUID chairId)
            implements DepartmentEvent {
        @Override
        public EventType eventType() {
            return EventType.CHAIR_ASSIGNED_TO_DEPARTMENT;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID departmentId)
            implements DepartmentEvent {
        @Override
        public EventType eventType() {
            return EventType.DEPARTMENT_DELETED;
        }
    }
}
