package com.zeus.people.eventstore;

import java.util.UUID;

/**
 * The aggregate's stream moved past the expected version. Nothing was written; the caller reloads
 * and retries.
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final UUID aggregateId;
    private final int expectedVersion;
    private final int actualVersion;

    public ConcurrencyConflictException(UUID aggregateId, int expectedVersion, int actualVersion) {
        super("Concurrency conflict on aggregate " + aggregateId + ". Expected version "
                + expectedVersion + ", but current version is " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public UUID aggregateId() {
        return aggregateId;
    }

    public int expectedVersion() {
        return expectedVersion;
    }

    public int actualVersion() {
        return actualVersion;
    }
}
