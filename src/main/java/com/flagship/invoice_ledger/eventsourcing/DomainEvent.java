package com.flagship.invoice_ledger.eventsourcing;

/**
 * Base interface for domain events.
 *
 * A domain event is an immutable fact about one state change of one aggregate instance.
 * It carries only the data needed to replay the change. Stream id, version and
 * timestamp are not part of the event; the event store assigns them at append time
 * (see {@link EventEnvelope}).
 *
 * Implementations are Java records, so equality is structural.
 */
public interface DomainEvent {

    /**
     * The kind of this event within its aggregate's event family.
     * Projections dispatch on it.
     */
    EventKind kind();
}
