package com.zeus.people.eventstore.jdbc;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;

/**
 * {@link EventStore} over a relational database through Spring JDBC.
 *
 * <p>An append runs in one transaction: read the stream's current version, compare it with the
 * expected version, apply claims and insert one row per event. Concurrent writers on the same
 * stream are serialised by the unique {@code (aggregate_id, version)} constraint; the loser's
 * duplicate-key failure is reported as a {@link ConcurrencyConflictException}. No application
 * lock is taken.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String COLUMNS =
            "id, aggregate_id, aggregate_type, event_type, event_data, version, timestamp, event_id";

    private static final String INSERT_EVENT =
            "INSERT INTO domain_events (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT_CURRENT_VERSION =
            "SELECT COALESCE(MAX(version), 0) FROM domain_events WHERE aggregate_id = ?";
    private static final String SELECT_STREAM =
            "SELECT " + COLUMNS + " FROM domain_events WHERE aggregate_id = ? ORDER BY version";
    private static final String SELECT_STREAM_FROM_VERSION =
            "SELECT " + COLUMNS + " FROM domain_events WHERE aggregate_id = ? AND version > ? ORDER BY version";
    private static final String SELECT_FROM_TIMESTAMP =
            "SELECT " + COLUMNS + " FROM domain_events WHERE timestamp >= ?"
                    + " ORDER BY timestamp, aggregate_id, version";

    private static final String SELECT_CLAIM_HOLDER = "SELECT aggregate_id FROM unique_claim WHERE claim_key = ?";
    private static final String INSERT_CLAIM =
            "INSERT INTO unique_claim (claim_key, aggregate_id, claimed_at) VALUES (?, ?, ?)";
    private static final String DELETE_CLAIM = "DELETE FROM unique_claim WHERE claim_key = ? AND aggregate_id = ?";

    private static final RowMapper<StoredEvent> ROW_MAPPER = JdbcEventStore::mapRow;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final EventCodec codec;
    private final EventStoreMetrics metrics;
    private final Clock clock;

    /**
     * @param transactionTimeout upper bound for one append transaction; exceeding it is a storage
     *     failure
     */
    public JdbcEventStore(
            DataSource dataSource,
            PlatformTransactionManager transactionManager,
            EventCodec codec,
            EventStoreMetrics metrics,
            Duration transactionTimeout,
            Clock clock) {
        this.jdbc = new JdbcTemplate(dataSource);
        this.transactions = new TransactionTemplate(transactionManager);
        this.transactions.setTimeout((int) Math.max(1, transactionTimeout.toSeconds()));
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public AppendResult appendEvents(
            UUID aggregateId,
            String aggregateType,
            List<? extends DomainEvent> events,
            int expectedVersion,
            ClaimSet claims) {
        AppendBatches.validate(aggregateId, events, expectedVersion);
        Timer.Sample sample = metrics.startAppend();
        Outcome outcome = Outcome.FAILURE;
        try {
            AppendResult result = transactions.execute(
                    status -> append(aggregateId, aggregateType, events, expectedVersion, claims));
            outcome = Outcome.SUCCESS;
            log.debug("Appended {} event(s) to {} {} (v{} -> v{})",
                    events.size(), aggregateType, aggregateId, expectedVersion, result.newVersion());
            return result;
        } catch (ConcurrencyConflictException e) {
            outcome = Outcome.CONFLICT;
            log.warn(e.getMessage());
            throw e;
        } catch (UniqueClaimConflictException e) {
            outcome = Outcome.CLAIM_CONFLICT;
            log.warn("Append to {} {} rolled back: {}", aggregateType, aggregateId, e.getMessage());
            throw e;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // the stream may have moved under us; anything else is a storage failure
            int actual = readCurrentVersion(aggregateId);
            if (actual != expectedVersion) {
                outcome = Outcome.CONFLICT;
                log.warn("Concurrent append to {} {} detected at insert: expected v{}, now v{}",
                        aggregateType, aggregateId, expectedVersion, actual);
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, actual);
            }
            log.error("Append to {} {} failed without a version change", aggregateType, aggregateId, e);
            throw new EventStoreException("Failed to append events to aggregate " + aggregateId, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure appending to {} {}", aggregateType, aggregateId, e);
            throw new EventStoreException("Failed to append events to aggregate " + aggregateId, e);
        } finally {
            metrics.appendFinished(sample, aggregateType, outcome, events.size());
        }
    }

    private AppendResult append(
            UUID aggregateId,
            String aggregateType,
            List<? extends DomainEvent> events,
            int expectedVersion,
            ClaimSet claims) {
        int current = jdbc.queryForObject(SELECT_CURRENT_VERSION, Integer.class, aggregateId);
        if (current != expectedVersion) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, current);
        }
        applyClaims(aggregateId, claims);

        var stored = new ArrayList<StoredEvent>(events.size());
        for (DomainEvent event : events) {
            EncodedEvent encoded = codec.encode(event);
            var row = new StoredEvent(
                    UUID.randomUUID(),
                    aggregateId,
                    aggregateType,
                    encoded.eventType(),
                    encoded.payload(),
                    event.version(),
                    StoredEvent.timestampOf(event.occurredAt()),
                    event.eventId());
            jdbc.update(INSERT_EVENT,
                    row.id(),
                    row.aggregateId(),
                    row.aggregateType(),
                    row.eventType(),
                    row.eventData(),
                    row.version(),
                    toUtc(row.timestamp()),
                    row.eventId());
            stored.add(row);
        }
        return new AppendResult(aggregateId, expectedVersion, stored.get(stored.size() - 1).version(), stored);
    }

    private void applyClaims(UUID aggregateId, ClaimSet claims) {
        for (String key : claims.release()) {
            jdbc.update(DELETE_CLAIM, key, aggregateId);
        }
        for (String key : claims.acquire()) {
            List<UUID> holders = jdbc.queryForList(SELECT_CLAIM_HOLDER, UUID.class, key);
            if (!holders.isEmpty()) {
                if (holders.get(0).equals(aggregateId)) {
                    continue;
                }
                throw new UniqueClaimConflictException(key, holders.get(0));
            }
            try {
                jdbc.update(INSERT_CLAIM, key, aggregateId, toUtc(clock.instant()));
            } catch (DuplicateKeyException e) {
                throw new UniqueClaimConflictException(key, null);
            }
        }
    }

    @Override
    public List<DomainEvent> getEvents(UUID aggregateId) {
        return decode(query(SELECT_STREAM, aggregateId), true);
    }

    @Override
    public List<DomainEvent> getEventsFromVersion(UUID aggregateId, int fromVersionExclusive) {
        return decode(query(SELECT_STREAM_FROM_VERSION, aggregateId, fromVersionExclusive), true);
    }

    @Override
    public List<DomainEvent> getEventsFromTimestamp(Instant cutoff) {
        return decode(query(SELECT_FROM_TIMESTAMP, toUtc(StoredEvent.timestampOf(cutoff))), false);
    }

    @Override
    public int currentVersion(UUID aggregateId) {
        return readCurrentVersion(aggregateId);
    }

    @Override
    public List<StoredEvent> getStoredEvents(UUID aggregateId) {
        return query(SELECT_STREAM, aggregateId);
    }

    @Override
    public Optional<UUID> claimHolder(String claimKey) {
        try {
            return jdbc.queryForList(SELECT_CLAIM_HOLDER, UUID.class, claimKey).stream().findFirst();
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read claim " + claimKey, e);
        }
    }

    private int readCurrentVersion(UUID aggregateId) {
        try {
            Integer version = jdbc.queryForObject(SELECT_CURRENT_VERSION, Integer.class, aggregateId);
            return version == null ? 0 : version;
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read current version of aggregate " + aggregateId, e);
        }
    }

    private List<StoredEvent> query(String sql, Object... args) {
        try {
            return jdbc.query(sql, ROW_MAPPER, args);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read events", e);
        }
    }

    private List<DomainEvent> decode(List<StoredEvent> rows, boolean singleStream) {
        var events = new ArrayList<DomainEvent>(rows.size());
        for (StoredEvent row : rows) {
            events.add(codec.decode(row.eventType(), row.eventData()));
        }
        if (!rows.isEmpty()) {
            metrics.eventsRead(singleStream ? rows.get(0).aggregateType() : null, rows.size());
        }
        return events;
    }

    private static StoredEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new StoredEvent(
                rs.getObject("id", UUID.class),
                rs.getObject("aggregate_id", UUID.class),
                rs.getString("aggregate_type"),
                rs.getString("event_type"),
                rs.getString("event_data"),
                rs.getInt("version"),
                rs.getObject("timestamp", OffsetDateTime.class).toInstant(),
                rs.getObject("event_id", UUID.class));
    }

    private static OffsetDateTime toUtc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
