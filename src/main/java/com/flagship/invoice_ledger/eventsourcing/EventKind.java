package com.flagship.invoice_ledger.eventsourcing;

/**
 * Describes one kind of domain event of one aggregate type.
 *
 * Each aggregate type declares its event kinds as an enum implementing this
 * interface. The enum is the registry used to turn stored event names back into
 * event classes, and the switch target of the aggregate's projection.
 */
public interface EventKind {

    /**
     * Stable name persisted with every event of this kind, e.g. "ClientCreated".
     */
    String eventName();

    /**
     * The record class carrying this kind's payload.
     */
    Class<? extends DomainEvent> eventClass();

    /**
     * Whether this kind removes the aggregate from query results.
     */
    default boolean isTombstone() {
        return false;
    }
}
