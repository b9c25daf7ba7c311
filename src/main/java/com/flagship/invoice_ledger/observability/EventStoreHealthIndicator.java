package com.flagship.invoice_ledger.observability;

import com.flagship.invoice_ledger.eventstore.EventStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the event store answers queries.
 * Down when the backing store cannot be reached.
 */
@Component("eventStoreHealth")
public class EventStoreHealthIndicator implements HealthIndicator {

    private final EventStore eventStore;

    public EventStoreHealthIndicator(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    @Override
    public Health health() {
        try {
            long streams = eventStore.streamCount();
            return Health.up()
                    .withDetail("store", eventStore.getClass().getSimpleName())
                    .withDetail("streams", streams)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("store", eventStore.getClass().getSimpleName())
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
