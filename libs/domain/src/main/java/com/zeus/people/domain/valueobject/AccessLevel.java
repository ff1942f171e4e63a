package com.zeus.people.domain.valueobject;

/**
 * Telephone access level: {@code LOC} (local), {@code INT} (international) or {@code NAT}
 * (national).
 *
 * @param value the wrapped access level code
 */
public record AccessLevel(String value) {

    public static final String LOCAL = "LOC";
    public static final String INTERNATIONAL = "INT";
    public static final String NATIONAL = "NAT";

    public AccessLevel {
        validate(value).throwIfInvalid("access level");
    }

    public static AccessLevel of(String value) {
        return new AccessLevel(value);
    }

    public static AccessLevel local() {
        return new AccessLevel(LOCAL);
    }

    public static AccessLevel international() {
        return new AccessLevel(INTERNATIONAL);
    }

    public static AccessLevel national() {
        return new AccessLevel(NATIONAL);
    }

    public static ValidationResult validate(String value) {
        return ValidationResult.of(
                TextRules.oneOf(
                        value,
                        "Access level",
                        "Access level must be 'LOC' (Local), 'INT' (International), or 'NAT' (National)",
                        LOCAL,
                        INTERNATIONAL,
                        NATIONAL));
    }

    public boolean isLocal() {
        return LOCAL.equals(value);
    }

    public boolean isInternational() {
        return INTERNATIONAL.equals(value);
    }

    public boolean isNational() {
        return NATIONAL.equals(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
