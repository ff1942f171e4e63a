package com.zeus.people.domain.valueobject;

import java.util.regex.Pattern;

/**
 * Telephone extension number: digits only, at most 10 characters.
 *
 * @param value the wrapped extension number
 */
public record ExtNr(String value) {

    private static final Pattern FORMAT = Pattern.compile("^\\d+$");

    public ExtNr {
        validate(value).throwIfInvalid("extension number");
    }

    public static ExtNr of(String value) {
        return new ExtNr(value);
    }

    public static ValidationResult validate(String value) {
        return ValidationResult.of(
                TextRules.check(
                        value,
                        "Extension number",
                        10,
                        FORMAT,
                        "Extension number can only contain digits"));
    }

    @Override
    public String toString() {
        return value;
    }
}
