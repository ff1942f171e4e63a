package com.zeus.people.eventstore.codec;

import java.util.UUID;

/** A domain event could not be written as JSON; nothing is stored. */
public class EventEncodingException extends RuntimeException {

    private final UUID eventId;

    public EventEncodingException(UUID eventId, String message, Throwable cause) {
        super(message, cause);
        this.eventId = eventId;
    }

    public UUID eventId() {
        return eventId;
    }
}
