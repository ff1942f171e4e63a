package com.zeus.people.eventstore.publish;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Publishes by logging; used when no message bus is wired in. */
public class LoggingEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventPublisher.class);

    @Override
    public void publish(OutboundEvent event) {
        log.info("Published {} v{} for {} {} (eventId={})",
                event.eventType(), event.version(), event.aggregateType(), event.aggregateId(), event.eventId());
        log.debug("Payload of {}: {}", event.eventId(), event.payload());
    }
}
