package com.zeus.people.service.repository;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Puts the aggregate a repository call works on into the SLF4J MDC for the duration of that call,
 * then restores whatever the thread had before.
 */
public final class AggregateLogContext {

    public static final String MDC_AGGREGATE_ID = "aggregateId";
    public static final String MDC_AGGREGATE_TYPE = "aggregateType";

    private AggregateLogContext() {
        // utility class
    }

    public static <T> T callWith(String aggregateType, UUID aggregateId, Supplier<T> work) {
        String previousId = MDC.get(MDC_AGGREGATE_ID);
        String previousType = MDC.get(MDC_AGGREGATE_TYPE);
        try {
            set(MDC_AGGREGATE_TYPE, aggregateType);
            set(MDC_AGGREGATE_ID, aggregateId == null ? null : aggregateId.toString());
            return work.get();
        } finally {
            set(MDC_AGGREGATE_TYPE, previousType);
            set(MDC_AGGREGATE_ID, previousId);
        }
    }

    private static void set(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
