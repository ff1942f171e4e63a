package com.zeus.people.domain.valueobject;

import com.zeus.people.domain.ValidationException;

import java.util.List;

/**
 * Result of validating a raw value before it is wrapped in a value object.
 *
 * @param valid true if validation passed with no errors
 * @param errors human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, errors);
    }

    /** Valid when {@code errors} is empty, failed otherwise. */
    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? ok() : fail(errors);
    }

    /**
     * Throws a {@link ValidationException} carrying every error if this result is not valid.
     *
     * @param subject name of the validated value, used in the exception message
     */
    public void throwIfInvalid(String subject) {
        if (!valid) {
            throw new ValidationException(subject, errors);
        }
    }
}
