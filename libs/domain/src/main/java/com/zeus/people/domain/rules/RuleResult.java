package com.zeus.people.domain.rules;

import com.zeus.people.domain.BusinessRuleViolationException;

import java.util.Objects;

/**
 * Outcome of evaluating a business rule. A violation is data, not a control-flow jump; callers
 * that prefer an exception use {@link #orThrow()}.
 */
public sealed interface RuleResult {

    static RuleResult satisfied() {
        return Satisfied.INSTANCE;
    }

    static RuleResult violated(BusinessRule rule, String message) {
        return new Violated(rule, message);
    }

    /** A violation carrying the rule's own description as message. */
    static RuleResult violated(BusinessRule rule) {
        return new Violated(rule, rule.description());
    }

    boolean isSatisfied();

    /**
     * @throws BusinessRuleViolationException if this result is a violation
     */
    default void orThrow() {
        if (this instanceof Violated violated) {
            throw new BusinessRuleViolationException(violated.rule(), violated.message());
        }
    }

    final class Satisfied implements RuleResult {
        private static final Satisfied INSTANCE = new Satisfied();

        private Satisfied() {}

        @Override
        public boolean isSatisfied() {
            return true;
        }

        @Override
        public String toString() {
            return "Satisfied";
        }
    }

    record Violated(BusinessRule rule, String message) implements RuleResult {
        public Violated {
            Objects.requireNonNull(rule, "rule");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isSatisfied() {
            return false;
        }
    }
}
