package com.flagship.invoice_ledger.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventStoreMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final EventStoreMetrics metrics = new EventStoreMetrics(registry);

    @Test
    @DisplayName("appended events are counted in total and per aggregate and event")
    void appended() {
        metrics.recordEventAppended("Invoice", "InvoiceCreated");
        metrics.recordEventAppended("Invoice", "InvoiceCreated");
        metrics.recordEventAppended("Client", "ClientDeleted");

        assertEquals(3.0, registry.get("eventstore.events.appended.total").counter().count());
        assertEquals(2.0, registry.get("eventstore.events.appended")
                .tags("aggregate", "Invoice", "event", "InvoiceCreated").counter().count());
    }

    @Test
    @DisplayName("tag values are sanitized")
    void sanitizedTags() {
        metrics.recordConcurrencyConflict("Invoice line/item");
        metrics.recordValidationFailure(null);

        assertEquals(1.0, registry.get("eventstore.concurrency.conflicts")
                .tag("aggregate", "Invoice_line_item").counter().count());
        assertEquals(1.0, registry.get("eventstore.validation.failures")
                .tag("aggregate", "unknown").counter().count());
    }

    @Test
    @DisplayName("replays are timed and return the replay's result")
    void replayTimer() {
        String result = metrics.timeReplay("User", () -> "replayed");

        assertEquals("replayed", result);
        assertEquals(1, registry.get("eventstore.replay.duration").tag("aggregate", "User").timer().count());
    }
}
