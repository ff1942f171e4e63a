package com.zeus.people.domain;

import com.zeus.people.domain.rules.BusinessRule;

/**
 * Raised when an intra- or cross-aggregate invariant would be broken. The operation is aborted
 * before any event is raised, so no state has changed.
 */
public class BusinessRuleViolationException extends DomainException {

    private final BusinessRule rule;

    public BusinessRuleViolationException(BusinessRule rule, String message) {
        super(message);
        this.rule = rule;
    }

    /** The rule that was violated. */
    public BusinessRule rule() {
        return rule;
    }
}
