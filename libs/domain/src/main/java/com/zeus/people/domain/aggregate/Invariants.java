package com.zeus.people.domain.aggregate;

import com.zeus.people.domain.BusinessRuleViolationException;
import com.zeus.people.domain.ValidationException;
import com.zeus.people.domain.rules.BusinessRule;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Guard clauses shared by the aggregates. */
final class Invariants {

    private Invariants() {
        // utility class
    }

    static void require(boolean condition, BusinessRule rule, String message) {
        if (!condition) {
            throw new BusinessRuleViolationException(rule, message);
        }
    }

    static void requireNotDeleted(AggregateRoot<?> aggregate) {
        if (aggregate.isDeleted()) {
            throw new BusinessRuleViolationException(
                    BusinessRule.AGGREGATE_DELETED,
                    aggregate.aggregateType().value() + " " + aggregate.id() + " has been deleted");
        }
    }

    static UUID requireId(UUID id, String label) {
        if (id == null) {
            throw new ValidationException(label, List.of(label + " cannot be empty"));
        }
        return id;
    }

    /** Non-blank, at most {@code maxLength} characters; returns the trimmed name. */
    static String requireName(String name, String label, int maxLength) {
        var errors = new ArrayList<String>();
        if (name == null || name.isBlank()) {
            errors.add(label + " cannot be empty");
        } else if (name.trim().length() > maxLength) {
            errors.add(label + " cannot exceed " + maxLength + " characters");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(label.toLowerCase(), errors);
        }
        return name.trim();
    }
}
