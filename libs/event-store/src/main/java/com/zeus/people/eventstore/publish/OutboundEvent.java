package com.zeus.people.eventstore.publish;

import com.zeus.people.eventstore.StoredEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * A committed event as handed to the messaging collaborator, keyed by its type name.
 *
 * @param eventType canonical event tag, the routing key
 * @param eventId the event's identifier, for consumer-side de-duplication
 * @param aggregateId the stream the event belongs to
 * @param aggregateType canonical aggregate type name
 * @param version position in the stream
 * @param occurredAt when the event occurred (UTC)
 * @param payload the JSON payload as stored
 */
public record OutboundEvent(
        String eventType,
        UUID eventId,
        UUID aggregateId,
        String aggregateType,
        int version,
        Instant occurredAt,
        String payload) {

    public static OutboundEvent from(StoredEvent stored) {
        return new OutboundEvent(
                stored.eventType(),
                stored.eventId(),
                stored.aggregateId(),
                stored.aggregateType(),
                stored.version(),
                stored.timestamp(),
                stored.eventData());
    }
}
