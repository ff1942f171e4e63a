package com.zeus.people.service.repository;

import com.zeus.people.domain.rules.BusinessRule;
import com.zeus.people.domain.valueobject.RoomNr;

import java.util.UUID;

/** Names of the uniqueness claims the write side serialises through the event store. */
public final class ClaimKeys {

    static final String ROOM_NUMBER = "room-number:";
    static final String CHAIR_HOLDER = "chair-holder:";

    private ClaimKeys() {
        // utility class
    }

    /** Held by the room that uses {@code roomNr} in the building. */
    public static String roomNumber(UUID buildingId, RoomNr roomNr) {
        return ROOM_NUMBER + buildingId + ":" + roomNr;
    }

    /** Held by the chair the professor currently holds. */
    public static String chairHolder(UUID professorId) {
        return CHAIR_HOLDER + professorId;
    }

    /** The rule a conflict on {@code claimKey} reports. */
    public static BusinessRule ruleFor(String claimKey) {
        if (claimKey.startsWith(ROOM_NUMBER)) {
            return BusinessRule.ROOM_UNIQUENESS;
        }
        if (claimKey.startsWith(CHAIR_HOLDER)) {
            return BusinessRule.CHAIR_CARDINALITY;
        }
        return BusinessRule.DUPLICATE_ASSOCIATION;
    }
}
