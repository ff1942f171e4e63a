package com.zeus.people.domain.valueobject;

import java.util.regex.Pattern;

/**
 * Room number within a building, e.g. {@code 101} or {@code B-2.14}.
 *
 * @param value the wrapped room number
 */
public record RoomNr(String value) {

    private static final Pattern FORMAT = Pattern.compile("^[A-Za-z0-9\\-.]+$");

    public RoomNr {
        validate(value).throwIfInvalid("room number");
    }

    public static RoomNr of(String value) {
        return new RoomNr(value);
    }

    public static ValidationResult validate(String value) {
        return ValidationResult.of(
                TextRules.check(
                        value,
                        "Room number",
                        10,
                        FORMAT,
                        "Room number can only contain letters, numbers, hyphens, and periods"));
    }

    @Override
    public String toString() {
        return value;
    }
}
