package com.zeus.people.service.repository;

import com.zeus.people.domain.event.DomainEvent;
import com.zeus.people.eventstore.ClaimSet;

import java.util.List;

/**
 * Derives the uniqueness claims an append must take or give up from the events it carries.
 *
 * @param <A> aggregate type
 * @param <E> its event family
 */
@FunctionalInterface
public interface UniqueClaimPolicy<A, E extends DomainEvent> {

    /**
     * @param aggregate the aggregate after the pending events were applied
     * @param pending the events about to be appended, in order
     */
    ClaimSet claimsFor(A aggregate, List<E> pending);

    static <A, E extends DomainEvent> UniqueClaimPolicy<A, E> none() {
        return (aggregate, pending) -> ClaimSet.none();
    }
}
