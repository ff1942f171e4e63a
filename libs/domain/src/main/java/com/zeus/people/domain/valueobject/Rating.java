package com.zeus.people.domain.valueobject;

import java.util.ArrayList;

/**
 * Teaching rating on a scale from 1 to 7 inclusive.
 *
 * @param value the wrapped rating
 */
public record Rating(int value) implements Comparable<Rating> {

    public static final int MINIMUM = 1;
    public static final int MAXIMUM = 7;

    public Rating {
        validate(value).throwIfInvalid("rating");
    }

    public static Rating of(int value) {
        return new Rating(value);
    }

    public static Rating minimum() {
        return new Rating(MINIMUM);
    }

    public static Rating maximum() {
        return new Rating(MAXIMUM);
    }

    public static ValidationResult validate(int value) {
        var errors = new ArrayList<String>();
        if (value < MINIMUM || value > MAXIMUM) {
            errors.add("Rating must be between 1 and 7");
        }
        return ValidationResult.of(errors);
    }

    @Override
    public int compareTo(Rating other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
