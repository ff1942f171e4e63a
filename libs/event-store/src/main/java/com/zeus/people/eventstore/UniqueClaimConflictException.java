package com.zeus.people.eventstore;

import java.util.UUID;

/**
 * A uniqueness claim requested with an append is already held by another aggregate. The whole
 * append was rolled back.
 */
public class UniqueClaimConflictException extends RuntimeException {

    private final String claimKey;
    private final UUID holderId;

    public UniqueClaimConflictException(String claimKey, UUID holderId) {
        super("Claim '" + claimKey + "' is already held"
                + (holderId == null ? "" : " by aggregate " + holderId));
        this.claimKey = claimKey;
        this.holderId = holderId;
    }

    public String claimKey() {
        return claimKey;
    }

    /** The aggregate holding the claim, or null when it was taken by a concurrent append. */
    public UUID holderId() {
        return holderId;
    }
}
