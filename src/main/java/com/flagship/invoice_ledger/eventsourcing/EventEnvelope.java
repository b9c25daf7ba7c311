package com.flagship.invoice_ledger.eventsourcing;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event together with the metadata assigned when it was appended.
 *
 * Versions within one stream start at 1 and grow by one per event with no gaps.
 * The version order is the replay order.
 */
@Value
public class EventEnvelope {
    UUID streamId;
    String aggregateType;
    String eventName;
    long version;
    Instant occurredOn;
    DomainEvent event;

    public boolean isTombstone() {
        return event.kind().isTombstone();
    }
}
