package com.flagship.invoice_ledger.eventsourcing.exception;

/**
 * An event has no projection handler for the aggregate type of its stream.
 * Means stored data and code disagree; the replay is aborted.
 */
public class UnhandledEventKindException extends EventSourcingException {

    private final String aggregateType;
    private final String eventName;

    public UnhandledEventKindException(String aggregateType, String eventName) {
        super(String.format("No %s projection handler for event %s", aggregateType, eventName));
        this.aggregateType = aggregateType;
        this.eventName = eventName;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getEventName() {
        return eventName;
    }
}
