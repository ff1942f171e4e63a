package com.zeus.people.eventstore.codec;

/**
 * A stored payload could not be turned back into its domain event: unknown tag, malformed JSON or
 * a value that fails validation. Indicates corruption or an unknown schema; never skipped.
 */
public class EventDecodingException extends RuntimeException {

    private final String eventType;

    public EventDecodingException(String eventType, String message) {
        super(message);
        this.eventType = eventType;
    }

    public EventDecodingException(String eventType, String message, Throwable cause) {
        super(message, cause);
        this.eventType = eventType;
    }

    /** The tag that was being decoded. */
    public String eventType() {
        return eventType;
    }
}
