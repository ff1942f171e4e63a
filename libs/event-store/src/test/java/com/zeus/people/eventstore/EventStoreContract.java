package com.zeus.people.eventstore;

import com.zeus.people.domain.event.DepartmentEvent;
import com.zeus.people.domain.event.DomainEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every {@link EventStore} implementation must show. Subclasses supply the store.
 */
public abstract class EventStoreContract {

    protected static final String DEPARTMENT = "Department";
    protected static final Instant START = Instant.parse("2025-03-01T09:00:00Z");

    protected EventStore store;

    protected abstract EventStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("a new stream starts at version 0 and reads back in order")
        void appendAndRead() {
            UUID id = UUID.randomUUID();
            var events = SampleEvents.departmentStream(id, START, 2);

            AppendResult result = store.appendEvents(id, DEPARTMENT, events, 0);

            assertThat(result.oldVersion()).isZero();
            assertThat(result.newVersion()).isEqualTo(3);
            assertThat(result.storedEvents()).hasSize(3);
            assertThat(store.getEvents(id)).containsExactlyElementsOf(events);
            assertThat(store.currentVersion(id)).isEqualTo(3);
        }

        @Test
        @DisplayName("successive appends extend the stream")
        void successiveAppends() {
            UUID id = UUID.randomUUID();
            store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 0), 0);
            var next = SampleEvents.memberAdded(id, 2, START.plusSeconds(60));

            AppendResult result = store.appendEvents(id, DEPARTMENT, List.of(next), 1);

            assertThat(result.oldVersion()).isEqualTo(1);
            assertThat(result.newVersion()).isEqualTo(2);
            assertThat(store.getEvents(id)).extracting(DomainEvent::version).containsExactly(1, 2);
        }

        @Test
        @DisplayName("a stale expected version is rejected and leaves the stream unchanged")
        void staleExpectedVersion() {
            UUID id = UUID.randomUUID();
            store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 1), 0);
            var stale = SampleEvents.memberAdded(id, 2, START.plusSeconds(60));

            assertThatThrownBy(() -> store.appendEvents(id, DEPARTMENT, List.of(stale), 1))
                    .isInstanceOf(ConcurrencyConflictException.class)
                    .hasMessage("Concurrency conflict on aggregate " + id + ". Expected version 1, but current version is 2");
            assertThat(store.currentVersion(id)).isEqualTo(2);
            assertThat(store.getEvents(id)).doesNotContain(stale);
        }

        @Test
        @DisplayName("creating an existing stream again conflicts")
        void createTwice() {
            UUID id = UUID.randomUUID();
            store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 0), 0);

            assertThatThrownBy(() -> store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 0), 0))
                    .isInstanceOfSatisfying(ConcurrencyConflictException.class, e -> {
                        assertThat(e.expectedVersion()).isZero();
                        assertThat(e.actualVersion()).isEqualTo(1);
                    });
        }

        @Test
        @DisplayName("an empty batch is rejected")
        void emptyBatch() {
            assertThatThrownBy(() -> store.appendEvents(UUID.randomUUID(), DEPARTMENT, List.of(), 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("a batch whose versions do not follow the expected version is rejected")
        void misnumberedBatch() {
            UUID id = UUID.randomUUID();
            var events = SampleEvents.departmentStream(id, START, 1);

            assertThatThrownBy(() -> store.appendEvents(id, DEPARTMENT, events.subList(1, 2), 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(store.currentVersion(id)).isZero();
        }

        @Test
        @DisplayName("an event of another aggregate is rejected")
        void foreignEvent() {
            UUID id = UUID.randomUUID();
            var foreign = SampleEvents.departmentStream(UUID.randomUUID(), START, 0);

            assertThatThrownBy(() -> store.appendEvents(id, DEPARTMENT, foreign, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("envelopes carry the event's tag, identity and timestamp")
        void envelopes() {
            UUID id = UUID.randomUUID();
            var events = SampleEvents.departmentStream(id, START, 1);
            store.appendEvents(id, DEPARTMENT, events, 0);

            List<StoredEvent> stored = store.getStoredEvents(id);

            assertThat(stored).hasSize(2);
            assertThat(stored.get(0).aggregateType()).isEqualTo(DEPARTMENT);
            assertThat(stored.get(0).eventType()).isEqualTo("DepartmentCreated");
            assertThat(stored.get(1).eventType()).isEqualTo("DepartmentAcademicAdded");
            assertThat(stored.get(1).eventId()).isEqualTo(events.get(1).eventId());
            assertThat(stored.get(1).timestamp()).isEqualTo(events.get(1).occurredAt());
            assertThat(stored).extracting(StoredEvent::id).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        @DisplayName("an unknown aggregate has no events and version 0")
        void unknownAggregate() {
            UUID id = UUID.randomUUID();

            assertThat(store.getEvents(id)).isEmpty();
            assertThat(store.getStoredEvents(id)).isEmpty();
            assertThat(store.currentVersion(id)).isZero();
        }

        @Test
        @DisplayName("reading from a version returns only later events")
        void fromVersion() {
            UUID id = UUID.randomUUID();
            var events = SampleEvents.departmentStream(id, START, 3);
            store.appendEvents(id, DEPARTMENT, events, 0);

            assertThat(store.getEventsFromVersion(id, 2)).containsExactlyElementsOf(events.subList(2, 4));
            assertThat(store.getEventsFromVersion(id, 4)).isEmpty();
            assertThat(store.getEventsFromVersion(id, 0)).containsExactlyElementsOf(events);
        }

        @Test
        @DisplayName("reading from a timestamp spans aggregates in timestamp order")
        void fromTimestamp() {
            Instant base = Instant.parse("2031-06-01T12:00:00Z");
            UUID first = UUID.randomUUID();
            UUID second = UUID.randomUUID();
            var older = new DepartmentEvent.Created(UUID.randomUUID(), base.minusSeconds(30), 1, first, "Old");
            var a1 = new DepartmentEvent.Created(UUID.randomUUID(), base.plusSeconds(10), 1, second, "Chemistry");
            var b2 = SampleEvents.memberAdded(first, 2, base.plusSeconds(5));
            var a2 = SampleEvents.memberAdded(second, 2, base.plusSeconds(20));
            store.appendEvents(first, DEPARTMENT, List.of(older), 0);
            store.appendEvents(second, DEPARTMENT, List.of(a1), 0);
            store.appendEvents(first, DEPARTMENT, List.of(b2), 1);
            store.appendEvents(second, DEPARTMENT, List.of(a2), 1);

            List<DomainEvent> since = store.getEventsFromTimestamp(base);

            assertThat(since).containsExactly(b2, a1, a2);
        }

        @Test
        @DisplayName("the timestamp cutoff is inclusive")
        void cutoffInclusive() {
            Instant at = Instant.parse("2032-01-01T00:00:00Z");
            UUID id = UUID.randomUUID();
            var created = new DepartmentEvent.Created(UUID.randomUUID(), at, 1, id, "Mathematics");
            store.appendEvents(id, DEPARTMENT, List.of(created), 0);

            assertThat(store.getEventsFromTimestamp(at)).containsExactly(created);
            assertThat(store.getEventsFromTimestamp(at.plusMillis(1))).doesNotContain(created);
        }

        @Test
        @DisplayName("a sub-microsecond occurrence is still found from its own instant")
        void cutoffInclusiveBelowMicroseconds() {
            Instant at = Instant.parse("2032-01-01T00:00:00.000000400Z");
            UUID id = UUID.randomUUID();
            var created = new DepartmentEvent.Created(UUID.randomUUID(), at, 1, id, "Mathematics");
            store.appendEvents(id, DEPARTMENT, List.of(created), 0);

            assertThat(store.getEventsFromTimestamp(at)).containsExactly(created);
            assertThat(store.getStoredEvents(id)).singleElement()
                    .satisfies(e -> assertThat(e.timestamp()).isEqualTo(Instant.parse("2032-01-01T00:00:00Z")));
            assertThat(store.getEventsFromTimestamp(Instant.parse("2032-01-01T00:00:00.000001Z"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("unique claims")
    class Claims {

        @Test
        @DisplayName("a claim is recorded with the append")
        void acquire() {
            UUID id = UUID.randomUUID();
            store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 0), 0,
                    ClaimSet.acquiring("room-number:b1:101"));

            assertThat(store.claimHolder("room-number:b1:101")).contains(id);
            assertThat(store.claimHolder("room-number:b1:102")).isEmpty();
        }

        @Test
        @DisplayName("a claim held by another aggregate rolls back the whole append")
        void conflict() {
            UUID holder = UUID.randomUUID();
            UUID other = UUID.randomUUID();
            store.appendEvents(holder, DEPARTMENT, SampleEvents.departmentStream(holder, START, 0), 0,
                    ClaimSet.acquiring("chair-holder:p1"));

            assertThatThrownBy(() -> store.appendEvents(other, DEPARTMENT,
                    SampleEvents.departmentStream(other, START, 0), 0,
                    ClaimSet.acquiring("unrelated", "chair-holder:p1")))
                    .isInstanceOfSatisfying(UniqueClaimConflictException.class, e -> {
                        assertThat(e.claimKey()).isEqualTo("chair-holder:p1");
                        assertThat(e.holderId()).isEqualTo(holder);
                    });
            assertThat(store.currentVersion(other)).isZero();
            assertThat(store.claimHolder("unrelated")).isEmpty();
            assertThat(store.claimHolder("chair-holder:p1")).contains(holder);
        }

        @Test
        @DisplayName("re-acquiring an own claim is a no-op")
        void reacquire() {
            UUID id = UUID.randomUUID();
            store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 0), 0,
                    ClaimSet.acquiring("k"));

            store.appendEvents(id, DEPARTMENT, List.of(SampleEvents.memberAdded(id, 2, START)), 1,
                    ClaimSet.acquiring("k"));

            assertThat(store.claimHolder("k")).contains(id);
        }

        @Test
        @DisplayName("a released claim can be taken by another aggregate")
        void releaseThenAcquire() {
            UUID first = UUID.randomUUID();
            UUID second = UUID.randomUUID();
            store.appendEvents(first, DEPARTMENT, SampleEvents.departmentStream(first, START, 0), 0,
                    ClaimSet.acquiring("k"));
            store.appendEvents(first, DEPARTMENT, List.of(SampleEvents.memberAdded(first, 2, START)), 1,
                    ClaimSet.releasing("k"));

            store.appendEvents(second, DEPARTMENT, SampleEvents.departmentStream(second, START, 0), 0,
                    ClaimSet.acquiring("k"));

            assertThat(store.claimHolder("k")).contains(second);
        }

        @Test
        @DisplayName("releasing a claim held by another aggregate leaves it in place")
        void releaseForeign() {
            UUID holder = UUID.randomUUID();
            UUID other = UUID.randomUUID();
            store.appendEvents(holder, DEPARTMENT, SampleEvents.departmentStream(holder, START, 0), 0,
                    ClaimSet.acquiring("k"));

            store.appendEvents(other, DEPARTMENT, SampleEvents.departmentStream(other, START, 0), 0,
                    ClaimSet.releasing("k"));

            assertThat(store.claimHolder("k")).contains(holder);
        }

        @Test
        @DisplayName("a version conflict does not take the claim")
        void versionConflictKeepsClaimFree() {
            UUID id = UUID.randomUUID();
            store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 0), 0);

            assertThatThrownBy(() -> store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 0), 0,
                    ClaimSet.acquiring("k")))
                    .isInstanceOf(ConcurrencyConflictException.class);
            assertThat(store.claimHolder("k")).isEmpty();
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("of two racing appends at the same version exactly one wins")
        void oneWinner() throws Exception {
            UUID id = UUID.randomUUID();
            store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 0), 0);
            var barrier = new CyclicBarrier(2);
            var candidates = List.of(
                    SampleEvents.memberAdded(id, 2, START.plusSeconds(1)),
                    SampleEvents.memberAdded(id, 2, START.plusSeconds(2)));

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                var futures = new ArrayList<Future<Boolean>>();
                for (DepartmentEvent candidate : candidates) {
                    Callable<Boolean> task = () -> {
                        barrier.await(5, TimeUnit.SECONDS);
                        try {
                            store.appendEvents(id, DEPARTMENT, List.of(candidate), 1);
                            return true;
                        } catch (ConcurrencyConflictException e) {
                            return false;
                        }
                    };
                    futures.add(pool.submit(task));
                }
                int winners = 0;
                for (Future<Boolean> future : futures) {
                    if (future.get(30, TimeUnit.SECONDS)) {
                        winners++;
                    }
                }

                assertThat(winners).isEqualTo(1);
                assertThat(store.currentVersion(id)).isEqualTo(2);
                assertThat(store.getEvents(id)).hasSize(2).containsAnyElementsOf(candidates);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("racing appends to different streams both succeed")
        void independentStreams() throws Exception {
            UUID first = UUID.randomUUID();
            UUID second = UUID.randomUUID();
            var barrier = new CyclicBarrier(2);

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                var futures = new ArrayList<Future<AppendResult>>();
                for (UUID id : List.of(first, second)) {
                    futures.add(pool.submit(() -> {
                        barrier.await(5, TimeUnit.SECONDS);
                        return store.appendEvents(id, DEPARTMENT, SampleEvents.departmentStream(id, START, 1), 0);
                    }));
                }
                for (Future<AppendResult> future : futures) {
                    assertThat(future.get(30, TimeUnit.SECONDS).newVersion()).isEqualTo(2);
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
