package com.zeus.people.service.projection;

import com.zeus.people.domain.aggregate.AggregateRoot;
import com.zeus.people.domain.event.DomainEvent;
import com.zeus.people.eventstore.EventStore;
import com.zeus.people.service.repository.AggregateDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory view of every live aggregate of one type, kept current by catching up on the event log.
 *
 * <p>{@link #refresh()} reads everything recorded since its cursor, then fetches the missing tail of
 * each touched stream by version. The view is as fresh as the last refresh; callers that check
 * cross-aggregate rules against it accept that window.
 *
 * <p>The cursor follows the events' {@code occurredAt}, not their commit order. An event committed
 * more than {@code overlap} after it occurred is only seen once a later event of the same aggregate
 * is; size the overlap above the longest gap between raising and committing an event.
 *
 * @param <A> aggregate type
 * @param <E> its event family
 */
public class AggregateProjection<A extends AggregateRoot<E>, E extends DomainEvent> {

    private static final Logger log = LoggerFactory.getLogger(AggregateProjection.class);

    private final EventStore store;
    private final AggregateDefinition<A, E> definition;
    private final Clock clock;
    private final Duration overlap;

    private final Map<UUID, List<E>> histories = new HashMap<>();
    private final Map<UUID, A> live = new LinkedHashMap<>();
    private Instant cursor;

    /**
     * @param overlap how far each refresh re-reads behind the newest timestamp already seen
     */
    public AggregateProjection(
            EventStore store, AggregateDefinition<A, E> definition, Clock clock, Duration overlap) {
        this.store = store;
        this.definition = definition;
        this.clock = clock;
        this.overlap = overlap;
    }

    /**
     * Catches up with the event log.
     *
     * @return number of aggregates rebuilt
     */
    public synchronized int refresh() {
        Instant from = cursor == null ? Instant.EPOCH : cursor.minus(overlap);
        Set<UUID> touched = new LinkedHashSet<>();
        Instant newest = cursor;
        for (DomainEvent event : store.getEventsFromTimestamp(from)) {
            if (!definition.eventFamily().isInstance(event)) {
                continue;
            }
            if (newest == null || event.occurredAt().isAfter(newest)) {
                newest = event.occurredAt();
            }
            if (event.version() > knownVersion(event.aggregateId())) {
                touched.add(event.aggregateId());
            }
        }
        for (UUID id : touched) {
            rebuild(id);
        }
        cursor = newest;
        if (!touched.isEmpty()) {
            log.debug("{} projection caught up on {} aggregate(s), {} live",
                    definition.type().value(), touched.size(), live.size());
        }
        return touched.size();
    }

    /** Live aggregates as of the last refresh, in first-seen order. */
    public synchronized List<A> all() {
        return List.copyOf(live.values());
    }

    public synchronized Optional<A> find(UUID id) {
        return Optional.ofNullable(live.get(id));
    }

    public synchronized int size() {
        return live.size();
    }

    private int knownVersion(UUID id) {
        List<E> history = histories.get(id);
        return history == null ? 0 : history.size();
    }

    private void rebuild(UUID id) {
        List<E> history = histories.computeIfAbsent(id, key -> new ArrayList<>());
        history.addAll(definition.narrow(store.getEventsFromVersion(id, history.size())));
        A aggregate = definition.reconstruct(List.copyOf(history), clock);
        if (aggregate.isDeleted()) {
            live.remove(id);
        } else {
            live.put(id, aggregate);
        }
    }
}
