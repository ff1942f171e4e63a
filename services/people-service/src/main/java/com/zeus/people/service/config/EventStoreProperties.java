package com.zeus.people.service.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Event store tuning, bound from {@code zeus.event-store.*}.
 *
 * <pre>
 * zeus:
 *   event-store:
 *     store-name: people
 *     transaction-timeout: 30s
 *     max-append-attempts: 3
 *     projection-overlap: 5s
 * </pre>
 *
 * @param storeName value of the {@code store} tag on every event store meter
 * @param transactionTimeout upper bound for one append transaction
 * @param maxAppendAttempts how often a repository reloads and retries a mutation after a
 *     concurrency conflict, including the first attempt
 * @param projectionOverlap how far a catch-up projection re-reads behind its cursor, to pick up
 *     events whose writers' clocks ran slightly behind
 */
@ConfigurationProperties(prefix = "zeus.event-store")
@Validated
public record EventStoreProperties(
        String storeName,
        Duration transactionTimeout,
        @Min(1) @Max(20) int maxAppendAttempts,
        Duration projectionOverlap) {

    public EventStoreProperties {
        if (storeName == null || storeName.isBlank()) {
            storeName = "people";
        }
        if (transactionTimeout == null || transactionTimeout.isNegative() || transactionTimeout.isZero()) {
            transactionTimeout = Duration.ofSeconds(30);
        }
        if (maxAppendAttempts <= 0) {
            maxAppendAttempts = 3;
        }
        if (projectionOverlap == null || projectionOverlap.isNegative()) {
            projectionOverlap = Duration.ofSeconds(5);
        }
    }
}
