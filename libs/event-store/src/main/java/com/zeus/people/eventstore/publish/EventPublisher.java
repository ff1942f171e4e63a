package com.zeus.people.eventstore.publish;

/**
 * Outbound port to the messaging collaborator. Called once per committed event, in append order.
 * Bus-side exactly-once delivery is not guaranteed.
 */
@FunctionalInterface
public interface EventPublisher {

    void publish(OutboundEvent event);
}
