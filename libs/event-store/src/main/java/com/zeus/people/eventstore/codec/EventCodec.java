package com.zeus.people.eventstore.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zeus.people.domain.event.DomainEvent;
import com.zeus.people.domain.event.EventType;

/**
 * Maps domain events to and from their stored JSON form.
 *
 * <p>The tag is the event's {@link EventType#value()}; decoding dispatches on it through
 * {@link EventType#fromTag(String)} to the exact record type. Instants and dates are ISO-8601
 * strings.
 */
public final class EventCodec {

    private final ObjectMapper mapper;

    public EventCodec() {
        this(defaultMapper());
    }

    /** Uses a caller-supplied mapper; it must have {@link ValueObjectModule} registered. */
    public EventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** The mapper configuration events are stored with. */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new ValueObjectModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @throws EventEncodingException if the event cannot be written as JSON
     */
    public EncodedEvent encode(DomainEvent event) {
        try {
            return new EncodedEvent(event.eventType().value(), mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new EventEncodingException(event.eventId(), "Failed to encode event: " + event.eventId(), e);
        }
    }

    /**
     * @throws EventDecodingException if the tag is unknown or the payload does not decode to a
     *     valid event of that type
     */
    public DomainEvent decode(String eventType, String payload) {
        EventType type = EventType.fromTag(eventType)
                .orElseThrow(() -> new EventDecodingException(eventType, "Unknown event type: " + eventType));
        DomainEvent event;
        try {
            event = mapper.readValue(payload, type.eventClass());
        } catch (JsonProcessingException e) {
            throw new EventDecodingException(
                    eventType, "Failed to decode " + eventType + ": " + e.getOriginalMessage(), e);
        } catch (RuntimeException e) {
            throw new EventDecodingException(eventType, "Failed to decode " + eventType + ": " + e.getMessage(), e);
        }
        if (event == null) {
            throw new EventDecodingException(eventType, "Empty payload for " + eventType);
        }
        return event;
    }
}
