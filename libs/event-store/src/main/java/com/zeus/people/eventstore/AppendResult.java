package com.zeus.people.eventstore;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a successful append.
 *
 * @param aggregateId the stream written to
 * @param oldVersion version before the append (the expected version)
 * @param newVersion version of the last appended event
 * @param storedEvents the envelopes written, in version order
 */
public record AppendResult(UUID aggregateId, int oldVersion, int newVersion, List<StoredEvent> storedEvents) {

    public AppendResult {
        storedEvents = List.copyOf(storedEvents);
    }
}
