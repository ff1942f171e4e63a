package com.zeus.people.eventstore.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Micrometer meters for the event store. Every meter carries a {@code store} tag naming the store
 * implementation and an {@code aggregate_type} tag. Meters of a store running inside a service also
 * carry a {@code service} tag.
 */
public final class EventStoreMetrics {

    public static final String TAG_STORE = "store";
    public static final String TAG_AGGREGATE_TYPE = "aggregate_type";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_SERVICE = "service";

    public static final String EVENTS_APPENDED = "zeus.eventstore.events.appended";
    public static final String APPEND_CONFLICTS = "zeus.eventstore.append.conflicts";
    public static final String APPEND_FAILURES = "zeus.eventstore.append.failures";
    public static final String APPEND_DURATION = "zeus.eventstore.append.duration";
    public static final String EVENTS_READ = "zeus.eventstore.events.read";

    /** Outcome tag values of {@link #APPEND_DURATION}. */
    public enum Outcome {
        SUCCESS, CONFLICT, CLAIM_CONFLICT, FAILURE;

        String tag() {
            return name().toLowerCase();
        }
    }

    private final MeterRegistry registry;
    private final String storeName;
    private final String serviceName;

    public EventStoreMetrics(MeterRegistry registry, String storeName) {
        this(registry, storeName, null);
    }

    /**
     * @param serviceName value of the {@code service} tag; {@code null} leaves the tag off
     */
    public EventStoreMetrics(MeterRegistry registry, String storeName, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (storeName == null || storeName.isBlank()) {
            throw new IllegalArgumentException("storeName must not be null or blank");
        }
        if (serviceName != null && serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
        this.registry = registry;
        this.storeName = storeName;
        this.serviceName = serviceName;
    }

    /** Metrics backed by a private in-process registry, for stores built outside a container. */
    public static EventStoreMetrics standalone(String storeName) {
        return new EventStoreMetrics(new SimpleMeterRegistry(), storeName);
    }

    public Timer.Sample startAppend() {
        return Timer.start(registry);
    }

    /** Records the duration and outcome of one append call. */
    public void appendFinished(Timer.Sample sample, String aggregateType, Outcome outcome, int eventCount) {
        sample.stop(Timer.builder(APPEND_DURATION)
                .description("Time spent appending a batch of events")
                .tags(tags(aggregateType).and(TAG_OUTCOME, outcome.tag()))
                .register(registry));
        switch (outcome) {
            case SUCCESS -> counter(EVENTS_APPENDED, "Events appended", aggregateType).increment(eventCount);
            case CONFLICT, CLAIM_CONFLICT -> Counter.builder(APPEND_CONFLICTS)
                    .description("Appends rejected by a version or claim conflict")
                    .tags(tags(aggregateType).and("reason", outcome.tag()))
                    .register(registry)
                    .increment();
            case FAILURE -> counter(APPEND_FAILURES, "Appends failed by storage errors", aggregateType).increment();
        }
    }

    public void eventsRead(String aggregateType, int count) {
        counter(EVENTS_READ, "Events read and decoded", aggregateType).increment(count);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String name, String description, String aggregateType) {
        return Counter.builder(name)
                .description(description)
                .tags(tags(aggregateType))
                .register(registry);
    }

    private Tags tags(String aggregateType) {
        Tags tags = Tags.of(TAG_STORE, storeName, TAG_AGGREGATE_TYPE, aggregateType == null ? "all" : aggregateType);
        return serviceName == null ? tags : tags.and(TAG_SERVICE, serviceName);
    }
}
