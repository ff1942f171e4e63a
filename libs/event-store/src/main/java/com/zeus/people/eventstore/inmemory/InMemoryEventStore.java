package com.zeus.people.eventstore.inmemory;

import com.zeus.people.domain.event.DomainEvent;
import com.zeus.people.eventstore.AppendBatches;
import com.zeus.people.eventstore.AppendResult;
import com.zeus.people.eventstore.ClaimSet;
import com.zeus.people.eventstore.ConcurrencyConflictException;
import com.zeus.people.eventstore.EventStore;
import com.zeus.people.eventstore.EventStoreException;
import com.zeus.people.eventstore.StoredEvent;
import com.zeus.people.eventstore.UniqueClaimConflictException;
import com.zeus.people.eventstore.codec.EncodedEvent;
import com.zeus.people.eventstore.codec.EventCodec;
import com.zeus.people.eventstore.metrics.EventStoreMetrics;
import com.zeus.people.eventstore.metrics.EventStoreMetrics.Outcome;
import io.micrometer.core.instrument.Timer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static java.util.Comparator.comparing;

/**
 * An {@link EventStore} that keeps events in memory. Mainly useful for tests and embedded use.
 *
 * <p>Events are stored encoded, exactly as the JDBC store writes them, so reads exercise the same
 * codec. All operations are serialised on the store's monitor; a failed append leaves no trace.
 */
public class InMemoryEventStore implements EventStore {

    private static final Comparator<StoredEvent> TIMESTAMP_ORDER = comparing(StoredEvent::timestamp)
            .thenComparing(StoredEvent::aggregateId)
            .thenComparingInt(StoredEvent::version);

    private final Map<UUID, List<StoredEvent>> streams = new LinkedHashMap<>();
    private final Set<UUID> eventIds = new HashSet<>();
    private final Map<String, UUID> claims = new HashMap<>();
    private final EventCodec codec;
    private final EventStoreMetrics metrics;

    public InMemoryEventStore() {
        this(new EventCodec(), EventStoreMetrics.standalone("in-memory"));
    }

    public InMemoryEventStore(EventCodec codec, EventStoreMetrics metrics) {
        this.codec = codec;
        this.metrics = metrics;
    }

    @Override
    public synchronized AppendResult appendEvents(
            UUID aggregateId,
            String aggregateType,
            List<? extends DomainEvent> events,
            int expectedVersion,
            ClaimSet claimSet) {
        AppendBatches.validate(aggregateId, events, expectedVersion);
        Timer.Sample sample = metrics.startAppend();
        Outcome outcome = Outcome.FAILURE;
        try {
            int current = currentVersion(aggregateId);
            if (current != expectedVersion) {
                outcome = Outcome.CONFLICT;
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, current);
            }
            for (String key : claimSet.acquire()) {
                UUID holder = claims.get(key);
                if (holder != null && !holder.equals(aggregateId)) {
                    outcome = Outcome.CLAIM_CONFLICT;
                    throw new UniqueClaimConflictException(key, holder);
                }
            }

            var stored = new ArrayList<StoredEvent>(events.size());
            for (DomainEvent event : events) {
                if (eventIds.contains(event.eventId())) {
                    throw new EventStoreException("Duplicate event id " + event.eventId());
                }
                EncodedEvent encoded = codec.encode(event);
                stored.add(new StoredEvent(
                        UUID.randomUUID(),
                        aggregateId,
                        aggregateType,
                        encoded.eventType(),
                        encoded.payload(),
                        event.version(),
                        StoredEvent.timestampOf(event.occurredAt()),
                        event.eventId()));
            }

            // nothing below can fail
            claimSet.release().forEach(key -> claims.remove(key, aggregateId));
            claimSet.acquire().forEach(key -> claims.put(key, aggregateId));
            streams.computeIfAbsent(aggregateId, id -> new ArrayList<>()).addAll(stored);
            stored.forEach(e -> eventIds.add(e.eventId()));
            outcome = Outcome.SUCCESS;
            return new AppendResult(aggregateId, expectedVersion, stored.get(stored.size() - 1).version(), stored);
        } finally {
            metrics.appendFinished(sample, aggregateType, outcome, events.size());
        }
    }

    @Override
    public synchronized List<DomainEvent> getEvents(UUID aggregateId) {
        return decode(getStoredEvents(aggregateId));
    }

    @Override
    public synchronized List<DomainEvent> getEventsFromVersion(UUID aggregateId, int fromVersionExclusive) {
        return decode(getStoredEvents(aggregateId).stream()
                .filter(e -> e.version() > fromVersionExclusive)
                .toList());
    }

    @Override
    public synchronized List<DomainEvent> getEventsFromTimestamp(Instant cutoff) {
        Instant from = StoredEvent.timestampOf(cutoff);
        return decode(streams.values().stream()
                .flatMap(List::stream)
                .filter(e -> !e.timestamp().isBefore(from))
                .sorted(TIMESTAMP_ORDER)
                .toList());
    }

    @Override
    public synchronized int currentVersion(UUID aggregateId) {
        List<StoredEvent> stream = streams.get(aggregateId);
        return stream == null ? 0 : stream.get(stream.size() - 1).version();
    }

    @Override
    public synchronized List<StoredEvent> getStoredEvents(UUID aggregateId) {
        return List.copyOf(streams.getOrDefault(aggregateId, List.of()));
    }

    @Override
    public synchronized Optional<UUID> claimHolder(String claimKey) {
        return Optional.ofNullable(claims.get(claimKey));
    }

    private List<DomainEvent> decode(List<StoredEvent> rows) {
        return rows.stream().map(e -> codec.decode(e.eventType(), e.eventData())).toList();
    }
}
