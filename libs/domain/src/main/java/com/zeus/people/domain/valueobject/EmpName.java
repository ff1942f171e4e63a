package com.zeus.people.domain.valueobject;

import java.util.regex.Pattern;

/**
 * Employee name: letters, spaces, hyphens and periods, at most 100 characters.
 *
 * @param value the wrapped name
 */
public record EmpName(String value) {

    private static final Pattern FORMAT = Pattern.compile("^[a-zA-Z\\s\\-.]+$");

    public EmpName {
        validate(value).throwIfInvalid("employee name");
    }

    public static EmpName of(String value) {
        return new EmpName(value);
    }

    public static ValidationResult validate(String value) {
        return ValidationResult.of(
                TextRules.check(
                        value,
                        "Employee name",
                        100,
                        FORMAT,
                        "Employee name can only contain letters, spaces, hyphens, and periods"));
    }

    @Override
    public String toString() {
        return value;
    }
}
