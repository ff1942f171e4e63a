package com.zeus.people.eventstore.inmemory;

import com.zeus.people.domain.event.DepartmentEvent;
import com.zeus.people.eventstore.EventStore;
import com.zeus.people.eventstore.EventStoreContract;
import com.zeus.people.eventstore.EventStoreException;
import com.zeus.people.eventstore.codec.EventCodec;
import com.zeus.people.eventstore.metrics.EventStoreMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryEventStore")
class InMemoryEventStoreTest extends EventStoreContract {

    private SimpleMeterRegistry registry;

    @Override
    protected EventStore createStore() {
        registry = new SimpleMeterRegistry();
        return new InMemoryEventStore(new EventCodec(), new EventStoreMetrics(registry, "memory"));
    }

    @Test
    @DisplayName("a reused event id is rejected")
    void duplicateEventId() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        var created = new DepartmentEvent.Created(UUID.randomUUID(), START, 1, first, "History");
        store.appendEvents(first, DEPARTMENT, List.of(created), 0);
        var reused = new DepartmentEvent.Created(created.eventId(), START, 1, second, "Geography");

        assertThatThrownBy(() -> store.appendEvents(second, DEPARTMENT, List.of(reused), 0))
                .isInstanceOf(EventStoreException.class)
                .hasMessageContaining(created.eventId().toString());
        assertThat(store.currentVersion(second)).isZero();
    }

    @Test
    @DisplayName("events are stored encoded and decoded on every read")
    void decodesOnRead() {
        UUID id = UUID.randomUUID();
        var created = new DepartmentEvent.Created(UUID.randomUUID(), START, 1, id, "History");
        store.appendEvents(id, DEPARTMENT, List.of(created), 0);

        assertThat(store.getStoredEvents(id).get(0).eventData()).contains("\"name\":\"History\"");
        assertThat(store.getEvents(id)).containsExactly(created);
        assertThat(store.getEvents(id).get(0)).isNotSameAs(created);
    }

    @Test
    @DisplayName("the default constructor wires a standalone registry")
    void defaults() {
        var standalone = new InMemoryEventStore();
        UUID id = UUID.randomUUID();

        standalone.appendEvents(id, DEPARTMENT, List.of(new DepartmentEvent.Created(UUID.randomUUID(), START, 1, id, "Art")), 0);

        assertThat(standalone.currentVersion(id)).isEqualTo(1);
        assertThat(registry.find(EventStoreMetrics.EVENTS_APPENDED).counters()).isEmpty();
    }
}
