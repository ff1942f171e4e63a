package com.zeus.people.domain;

/**
 * Base type for every failure raised by the domain layer.
 *
 * <p>Unchecked: domain failures are detected before any event is raised, so callers never need a
 * rollback and can translate them into result values at the boundary they own.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
