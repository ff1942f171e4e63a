package com.zeus.people.domain.valueobject;

import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * Employee number: two uppercase letters followed by four digits (e.g. {@code AB1234}).
 *
 * @param value the wrapped employee number
 */
public record EmpNr(String value) {

    private static final Pattern FORMAT = Pattern.compile("^[A-Z]{2}\\d{4}$");

    public EmpNr {
        validate(value).throwIfInvalid("employee number");
    }

    public static EmpNr of(String value) {
        return new EmpNr(value);
    }

    /** Validates a raw employee number without constructing one. */
    public static ValidationResult validate(String value) {
        var errors = new ArrayList<String>();
        if (value == null || value.isBlank()) {
            errors.add("Employee number cannot be empty");
            return ValidationResult.of(errors);
        }
        if (value.length() != 6) {
            errors.add("Employee number must be exactly 6 characters");
        }
        if (!FORMAT.matcher(value).matches()) {
            errors.add(
                    "Employee number must be 2 uppercase letters followed by 4 digits (e.g., AB1234)");
        }
        return ValidationResult.of(errors);
    }

    @Override
    public String toString() {
        return value;
    }
}
