package com.zeus.people.service.repository;

/** Why a repository or command call did not change anything. */
public enum ErrorKind {
    /** Input rejected by a value object; fix the input. */
    VALIDATION,
    /** An intra- or cross-aggregate invariant would break; fix the request. */
    BUSINESS_RULE,
    /** Someone else changed the aggregate first and retries were exhausted; try again. */
    CONCURRENCY_CONFLICT,
    /** No live aggregate with that id. */
    NOT_FOUND
}
