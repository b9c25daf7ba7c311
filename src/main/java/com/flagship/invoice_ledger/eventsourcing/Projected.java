package com.flagship.invoice_ledger.eventsourcing;

import lombok.Value;

/**
 * Result of folding an event stream: the aggregate state plus the stream-level
 * facts the aggregate itself does not carry.
 *
 * A deleted projection keeps its state and version; it is only hidden from
 * queries.
 */
@Value
public class Projected<A extends AggregateRoot<A>> {
    A state;
    long version;
    boolean deleted;

    public boolean isLive() {
        return !deleted;
    }
}
