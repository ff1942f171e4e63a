package com.zeus.people.domain.valueobject;

/**
 * Building name, at most 100 characters.
 *
 * @param value the wrapped building name
 */
public record BldgName(String value) {

    public BldgName {
        validate(value).throwIfInvalid("building name");
    }

    public static BldgName of(String value) {
        return new BldgName(value);
    }

    public static ValidationResult validate(String value) {
        return ValidationResult.of(TextRules.check(value, "Building name", 100, null, null));
    }

    @Override
    public String toString() {
        return value;
    }
}
