package com.zeus.people.service.repository;

import com.zeus.people.domain.BusinessRuleViolationException;
import com.zeus.people.domain.ValidationException;
import com.zeus.people.domain.aggregate.AggregateRoot;
import com.zeus.people.domain.event.DomainEvent;
import com.zeus.people.eventstore.AppendResult;
import com.zeus.people.eventstore.ClaimSet;
import com.zeus.people.eventstore.ConcurrencyConflictException;
import com.zeus.people.eventstore.EventStore;
import com.zeus.people.eventstore.StoredEvent;
import com.zeus.people.eventstore.UniqueClaimConflictException;
import com.zeus.people.eventstore.publish.EventPublisher;
import com.zeus.people.eventstore.publish.OutboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Write side for one aggregate type: load by replay, mutate through domain methods, append the
 * raised events with an expected-version check, then hand them to the publisher.
 *
 * <p>Validation, business-rule, concurrency and not-found outcomes come back as {@link Result}
 * failures. Storage and decode failures propagate as exceptions.
 *
 * @param <A> aggregate type
 * @param <E> its event family
 */
public class EventSourcedRepository<A extends AggregateRoot<E>, E extends DomainEvent> {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

    private final EventStore store;
    private final AggregateDefinition<A, E> definition;
    private final EventPublisher publisher;
    private final Clock clock;
    private final int maxAttempts;

    /**
     * @param maxAttempts how often {@link #execute} loads and mutates before giving up on
     *     concurrency conflicts, at least 1
     */
    public EventSourcedRepository(
            EventStore store,
            AggregateDefinition<A, E> definition,
            EventPublisher publisher,
            Clock clock,
            int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.store = store;
        this.definition = definition;
        this.publisher = publisher;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    public AggregateDefinition<A, E> definition() {
        return definition;
    }

    /**
     * Stores a newly created aggregate.
     *
     * @throws IllegalArgumentException if the aggregate was loaded from the store rather than created
     */
    public Result<UUID> add(A aggregate) {
        if (aggregate.committedVersion() != 0 || aggregate.uncommittedEvents().isEmpty()) {
            throw new IllegalArgumentException(
                    typeName() + " " + aggregate.id() + " is not new (version " + aggregate.version() + ")");
        }
        return AggregateLogContext.callWith(typeName(), aggregate.id(), () -> {
            try {
                append(aggregate);
                log.info("Added {} {}", typeName(), aggregate.id());
                return Result.success(aggregate.id());
            } catch (ConcurrencyConflictException e) {
                log.warn("{} {} already exists", typeName(), aggregate.id());
                return Result.failure(ErrorKind.CONCURRENCY_CONFLICT,
                        typeName() + " " + aggregate.id() + " already exists");
            } catch (UniqueClaimConflictException e) {
                return claimConflict(e);
            }
        });
    }

    /**
     * Appends the uncommitted events of an aggregate the caller loaded and mutated. Does not retry:
     * on a conflict the caller's copy is stale and must be reloaded.
     */
    public Result<A> update(A aggregate) {
        if (aggregate.uncommittedEvents().isEmpty()) {
            return Result.success(aggregate);
        }
        return AggregateLogContext.callWith(typeName(), aggregate.id(), () -> {
            try {
                append(aggregate);
                return Result.success(aggregate);
            } catch (ConcurrencyConflictException e) {
                log.warn(e.getMessage());
                return Result.failure(ErrorKind.CONCURRENCY_CONFLICT, e.getMessage());
            } catch (UniqueClaimConflictException e) {
                return claimConflict(e);
            }
        });
    }

    /** Deletes through the aggregate's deletion event; the history stays in the store. */
    public Result<Void> delete(UUID id) {
        return execute(id, definition.deletion()).map(deleted -> (Void) null);
    }

    /** Current state by replay; a deleted aggregate is not found. */
    public Result<A> load(UUID id) {
        return AggregateLogContext.callWith(typeName(), id, () -> loadLive(id));
    }

    /**
     * Loads the aggregate, applies {@code mutation} and appends what it raised. A concurrency
     * conflict reloads and reapplies the mutation, so it must be safe to run more than once.
     * Domain exceptions thrown by the mutation become failures and nothing is appended.
     */
    public Result<A> execute(UUID id, Consumer<? super A> mutation) {
        return AggregateLogContext.callWith(typeName(), id, () -> {
            for (int attempt = 1; ; attempt++) {
                Result<A> loaded = loadLive(id);
                if (!loaded.isSuccess()) {
                    return loaded;
                }
                A aggregate = loaded.value();
                try {
                    mutation.accept(aggregate);
                } catch (ValidationException e) {
                    log.debug("Rejected change to {} {}: {}", typeName(), id, e.getMessage());
                    return Result.failure(ErrorKind.VALIDATION, e.getMessage());
                } catch (BusinessRuleViolationException e) {
                    log.warn("Rejected change to {} {}: {}", typeName(), id, e.getMessage());
                    return Result.ruleViolation(e.rule(), e.getMessage());
                }
                if (aggregate.uncommittedEvents().isEmpty()) {
                    return Result.success(aggregate);
                }
                try {
                    append(aggregate);
                    return Result.success(aggregate);
                } catch (ConcurrencyConflictException e) {
                    if (attempt >= maxAttempts) {
                        log.warn("Giving up on {} {} after {} attempt(s): {}", typeName(), id, attempt, e.getMessage());
                        return Result.failure(ErrorKind.CONCURRENCY_CONFLICT, e.getMessage());
                    }
                    log.info("Concurrent change to {} {}, reloading (attempt {} of {})",
                            typeName(), id, attempt, maxAttempts);
                } catch (UniqueClaimConflictException e) {
                    return claimConflict(e);
                }
            }
        });
    }

    private Result<A> loadLive(UUID id) {
        List<DomainEvent> events = store.getEvents(id);
        if (events.isEmpty()) {
            return Result.failure(ErrorKind.NOT_FOUND, typeName() + " " + id + " not found");
        }
        A aggregate = definition.reconstruct(definition.narrow(events), clock);
        if (aggregate.isDeleted()) {
            return Result.failure(ErrorKind.NOT_FOUND, typeName() + " " + id + " has been deleted");
        }
        return Result.success(aggregate);
    }

    private void append(A aggregate) {
        List<E> pending = List.copyOf(aggregate.uncommittedEvents());
        ClaimSet claims = definition.claimPolicy().claimsFor(aggregate, pending);
        AppendResult result = store.appendEvents(
                aggregate.id(), typeName(), pending, aggregate.committedVersion(), claims);
        aggregate.markEventsAsCommitted();
        log.debug("Committed {} event(s) to {} {} at v{}",
                pending.size(), typeName(), aggregate.id(), result.newVersion());
        publish(result.storedEvents());
    }

    // runs after commit; failures are logged only
    private void publish(List<StoredEvent> committed) {
        for (StoredEvent stored : committed) {
            try {
                publisher.publish(OutboundEvent.from(stored));
            } catch (RuntimeException e) {
                log.error("Failed to publish {} v{} of {} {}",
                        stored.eventType(), stored.version(), stored.aggregateType(), stored.aggregateId(), e);
            }
        }
    }

    private <T> Result<T> claimConflict(UniqueClaimConflictException e) {
        log.warn(e.getMessage());
        return Result.ruleViolation(ClaimKeys.ruleFor(e.claimKey()), e.getMessage());
    }

    private String typeName() {
        return definition.type().value();
    }
}
