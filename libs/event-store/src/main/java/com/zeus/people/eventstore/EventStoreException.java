package com.zeus.people.eventstore;

/**
 * A storage failure: connectivity, timeout or an integrity violation that is not a version
 * conflict. Fatal for the operation that raised it.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
