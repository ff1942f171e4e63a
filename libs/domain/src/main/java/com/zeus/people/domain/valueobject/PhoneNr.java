package com.zeus.people.domain.valueobject;

import java.util.regex.Pattern;

/**
 * Phone number: digits, spaces, hyphens, parentheses and plus signs, at most 20 characters.
 *
 * @param value the wrapped phone number
 */
public record PhoneNr(String value) {

    private static final Pattern FORMAT = Pattern.compile("^[\\d\\-()+\\s]+$");

    public PhoneNr {
        validate(value).throwIfInvalid("phone number");
    }

    public static PhoneNr of(String value) {
        return new PhoneNr(value);
    }

    public static ValidationResult validate(String value) {
        return ValidationResult.of(
                TextRules.check(
                        value,
                        "Phone number",
                        20,
                        FORMAT,
                        "Phone number can only contain digits, spaces, hyphens, parentheses, and plus signs"));
    }

    @Override
    public String toString() {
        return value;
    }
}
