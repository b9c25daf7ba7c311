package com.flagship.invoice_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Metrics for the event store and the repositories on top of it.
 *
 * Metrics exposed:
 * - eventstore.events.appended: events written, tagged by aggregate type and event name
 * - eventstore.concurrency.conflicts: appends rejected by the version check
 * - eventstore.validation.failures: writes rejected before reaching the store
 * - eventstore.replay.duration: time to rebuild one aggregate from its stream
 */
@Component
public class EventStoreMetrics {

    private final MeterRegistry registry;

    private final Counter eventsAppended;

    public EventStoreMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.eventsAppended = Counter.builder("eventstore.events.appended.total")
                .description("Number of events appended across all streams")
                .register(registry);
    }

    /**
     * Records one appended event.
     * Tagged meters are looked up in the registry on every call.
     */
    public void recordEventAppended(String aggregateType, String eventName) {
        eventsAppended.increment();
        registry.counter("eventstore.events.appended",
                "aggregate", sanitizeTag(aggregateType),
                "event", sanitizeTag(eventName)
        ).increment();
    }

    public void recordConcurrencyConflict(String aggregateType) {
        registry.counter("eventstore.concurrency.conflicts",
                "aggregate", sanitizeTag(aggregateType)
        ).increment();
    }

    public void recordValidationFailure(String aggregateType) {
        registry.counter("eventstore.validation.failures",
                "aggregate", sanitizeTag(aggregateType)
        ).increment();
    }

    /**
     * Times a stream replay.
     */
    public <T> T timeReplay(String aggregateType, Supplier<T> replay) {
        return Timer.builder("eventstore.replay.duration")
                .description("Time taken to rebuild an aggregate from its events")
                .tag("aggregate", sanitizeTag(aggregateType))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(replay);
    }

    /**
     * Keeps tag values short and free of characters monitoring backends reject.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.-]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
