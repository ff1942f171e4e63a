package com.zeus.people.eventstore;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * One row of the event log, as persisted.
 *
 * @param id surrogate key of the row
 * @param aggregateId the stream this event belongs to
 * @param aggregateType canonical aggregate type name (e.g. "Academic")
 * @param eventType canonical event tag (e.g. "AcademicCreated")
 * @param eventData JSON payload of the event
 * @param version position in the stream, contiguous from 1
 * @param timestamp when the event occurred (UTC), at {@link #TIMESTAMP_PRECISION}
 * @param eventId the event's own identifier
 */
public record StoredEvent(
        UUID id,
        UUID aggregateId,
        String aggregateType,
        String eventType,
        String eventData,
        int version,
        Instant timestamp,
        UUID eventId) {

    /** Finest unit a {@code timestamp with time zone} column keeps. */
    public static final ChronoUnit TIMESTAMP_PRECISION = ChronoUnit.MICROS;

    /** {@code instant} as the log records it; also applied to timestamp cutoffs. */
    public static Instant timestampOf(Instant instant) {
        return instant.truncatedTo(TIMESTAMP_PRECISION);
    }
}
