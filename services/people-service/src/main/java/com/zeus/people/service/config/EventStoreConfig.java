package com.zeus.people.service.config;

import com.zeus.people.domain.aggregate.Academic;
import com.zeus.people.domain.aggregate.Chair;
import com.zeus.people.domain.aggregate.Room;
import com.zeus.people.domain.event.AcademicEvent;
import com.zeus.people.domain.event.ChairEvent;
import com.zeus.people.domain.event.RoomEvent;
import com.zeus.people.domain.rules.AcademicRules;
import com.zeus.people.eventstore.EventStore;
import com.zeus.people.eventstore.codec.EventCodec;
import com.zeus.people.eventstore.jdbc.JdbcEventStore;
import com.zeus.people.eventstore.metrics.EventStoreMetrics;
import com.zeus.people.eventstore.publish.EventPublisher;
import com.zeus.people.eventstore.publish.LoggingEventPublisher;
import com.zeus.people.service.command.PeopleCommandService;
import com.zeus.people.service.projection.AggregateProjection;
import com.zeus.people.service.repository.AggregateDefinition;
import com.zeus.people.service.repository.PeopleRepositories;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import javax.sql.DataSource;

/**
 * Wires the JDBC event store, the write repositories, the catch-up projections the business rules
 * read from, and the command service.
 *
 * <p>The store keeps its own {@link EventCodec} mapper, so the stored JSON format does not follow
 * changes to the application's Jackson settings.
 */
@Configuration
public class EventStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(EventStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public EventCodec eventCodec() {
        return new EventCodec();
    }

    @Bean
    public EventStoreMetrics eventStoreMetrics(
            MeterRegistry registry, EventStoreProperties properties, PeopleServiceProperties service) {
        return new EventStoreMetrics(registry, properties.storeName(), service.name());
    }

    @Bean
    public EventStore eventStore(
            DataSource dataSource,
            PlatformTransactionManager transactionManager,
            EventCodec codec,
            EventStoreMetrics metrics,
            EventStoreProperties properties,
            Clock clock) {
        log.info("Event store '{}' on JDBC, transaction timeout {}",
                properties.storeName(), properties.transactionTimeout());
        return new JdbcEventStore(
                dataSource, transactionManager, codec, metrics, properties.transactionTimeout(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventPublisher eventPublisher() {
        return new LoggingEventPublisher();
    }

    @Bean
    public PeopleRepositories peopleRepositories(
            EventStore store, EventPublisher publisher, Clock clock, EventStoreProperties properties) {
        return PeopleRepositories.over(store, publisher, clock, properties.maxAppendAttempts());
    }

    @Bean
    public AggregateProjection<Academic, AcademicEvent> academicProjection(
            EventStore store, Clock clock, EventStoreProperties properties) {
        return new AggregateProjection<>(store, AggregateDefinition.academic(), clock, properties.projectionOverlap());
    }

    @Bean
    public AggregateProjection<Chair, ChairEvent> chairProjection(
            EventStore store, Clock clock, EventStoreProperties properties) {
        return new AggregateProjection<>(store, AggregateDefinition.chair(), clock, properties.projectionOverlap());
    }

    @Bean
    public AggregateProjection<Room, RoomEvent> roomProjection(
            EventStore store, Clock clock, EventStoreProperties properties) {
        return new AggregateProjection<>(store, AggregateDefinition.room(), clock, properties.projectionOverlap());
    }

    @Bean
    public AcademicRules academicRules() {
        return new AcademicRules();
    }

    @Bean
    public PeopleCommandService peopleCommandService(
            PeopleRepositories repositories,
            AggregateProjection<Academic, AcademicEvent> academicProjection,
            AggregateProjection<Chair, ChairEvent> chairProjection,
            AggregateProjection<Room, RoomEvent> roomProjection,
            AcademicRules rules,
            Clock clock) {
        return new PeopleCommandService(
                repositories, academicProjection, chairProjection, roomProjection, rules, clock);
    }
}
