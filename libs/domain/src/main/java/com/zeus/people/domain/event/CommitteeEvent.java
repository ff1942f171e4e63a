package com.zeus.people.domain.event;

import java.time.Instant;
import java.util.UUID;

/** Events raised by the {@code Committee} aggregate. */
public sealed interface CommitteeEvent extends DomainEvent {

    UUID committeeId();

    @Override
    default UUID aggregateId() {
        return committeeId();
    }

    record Created(UUID eventId, Instant occurredAt, int version, UUID committeeId, String name)
            implements CommitteeEvent {
        @Override
        public EventType eventType() {
            return EventType.COMMITTEE_CREATED;
        }
    }

    record MemberAdded(UUID eventId, Instant occurredAt, int version, UUID committeeId, UUID professorId)
            implements CommitteeEvent {
        @Override
        public EventType eventType() {
            return EventType.COMMITTEE_MEMBER_ADDED;
        }
    }

    record MemberRemoved(
            UUID eventId, Instant occurredAt, int version, UUID committeeId, UUID professorId)
            implements CommitteeEvent {
        @Override
        public EventType eventType() {
            return EventType.COMMITTEE_MEMBER_REMOVED;
        }
    }

    record Deleted(UUID eventId, Instant occurredAt, int version, UUID committeeId)
            implements CommitteeEvent {
        @Override
        public EventType eventType() {
            return EventType.COMMITTEE_DELETED;
        }
    }
}
