package com.zeus.people.domain.valueobject;

/**
 * Building number, at most 20 characters.
 *
 * @param value the wrapped building number
 */
public record BldgNr(String value) {

    public BldgNr {
        validate(value).throwIfInvalid("building number");
    }

    public static BldgNr of(String value) {
        return new BldgNr(value);
    }

    public static ValidationResult validate(String value) {
        return ValidationResult.of(TextRules.check(value, "Building number", 20, null, null));
    }

    @Override
    public String toString() {
        return value;
    }
}
