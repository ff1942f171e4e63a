package com.zeus.people.domain;

import java.util.List;

/**
 * Raised when a value object rejects its input. The invalid value is never stored.
 */
public class ValidationException extends DomainException {

    private final String subject;
    private final List<String> errors;

    /**
     * @param subject human-readable name of the value being validated (e.g. "employee number")
     * @param errors every rule the value failed, in evaluation order
     */
    public ValidationException(String subject, List<String> errors) {
        super("Invalid " + subject + ": " + String.join(", ", errors));
        this.subject = subject;
        this.errors = List.copyOf(errors);
    }

    public String subject() {
        return subject;
    }

    public List<String> errors() {
        return errors;
    }
}
