package com.zeus.people.domain.valueobject;

import com.zeus.people.domain.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Non-negative amount of US dollars.
 *
 * <p>The wrapped value is normalised (trailing zeros stripped, never a negative scale) so that
 * {@code 10}, {@code 10.0} and {@code 10.00} are the same amount. Fractions of a cent are kept;
 * only {@link #toString()} rounds to cents.
 *
 * @param value the wrapped amount
 */
public record MoneyAmt(BigDecimal value) implements Comparable<MoneyAmt> {

    public MoneyAmt {
        validate(value).throwIfInvalid("money amount");
        value = normalise(value);
    }

    public static MoneyAmt of(BigDecimal value) {
        return new MoneyAmt(value);
    }

    public static MoneyAmt of(String value) {
        try {
            return new MoneyAmt(new BigDecimal(value));
        } catch (NumberFormatException e) {
            throw new ValidationException(
                    "money amount", List.of("Money amount must be a decimal number"));
        }
    }

    public static MoneyAmt zero() {
        return new MoneyAmt(BigDecimal.ZERO);
    }

    public static ValidationResult validate(BigDecimal value) {
        var errors = new ArrayList<String>();
        if (value == null) {
            errors.add("Money amount is required");
        } else if (value.signum() < 0) {
            errors.add("Money amount must be a positive value");
        }
        return ValidationResult.of(errors);
    }

    public MoneyAmt plus(MoneyAmt other) {
        return new MoneyAmt(value.add(other.value));
    }

    /** Subtracts {@code other}; fails validation if the result would be negative. */
    public MoneyAmt minus(MoneyAmt other) {
        return new MoneyAmt(value.subtract(other.value));
    }

    @Override
    public int compareTo(MoneyAmt other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return "$" + value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static BigDecimal normalise(BigDecimal amount) {
        BigDecimal stripped = amount.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
