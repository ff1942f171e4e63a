package com.zeus.people.domain.event;

import com.zeus.people.domain.valueobject.Rating;

import java.time.Instant;
import java.util.UUID;

/** Events raised by the {@code Subject} aggregate. */
public sealed interface SubjectEvent extends DomainEvent {

    UUID subjectId();

    @Override
    default UUID aggregateId() {
        return subjectId();
    }

    record Created(UUID eventId, Instant occurredAt, int version, UUID subjectId, String code)
            implements SubjectEvent {
        @Override
        public EventType eventType() {
            return EventType.SUBJECT_CREATED;
        }
    }

    record TeacherAdded(UUID eventId, Instant occurredAt, int version, UUID subjectId, UUID academicId)
            implements SubjectEvent {
        @Override
        public EventType eventType() {
            return EventType.SUBJECT_TEACHER_ADDED;
        }
    }

    record TeacherRemoved(UUID eventId, Instant occurredAt, int version, UUID subjectId, UUID academicId)
            implements SubjectEvent {
        @Override
        public EventType eventType() {
            return EventType.SUBJECT_TEACHER_REMOVED;
        }
    }

    record TeachingRated(
            UUID eventId, Instant occurredAt, int version, UUID subjectId, UUID academicId, Rating rating)
            implements SubjectEvent {
        @Override
        public EventType eventType() {
            return EventType.SUBJECT_TEACHING_RATED;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID subjectId)
            implements SubjectEvent {
        @Override
        public EventType eventType() {
            return EventType.SUBJECT_DELETED;
        }
    }
}
