package com.zeus.people.eventstore.codec;

/**
 * An event as written to the log.
 *
 * @param eventType the concrete type tag
 * @param payload field-name keyed JSON of the event
 */
public record EncodedEvent(String eventType, String payload) {}
