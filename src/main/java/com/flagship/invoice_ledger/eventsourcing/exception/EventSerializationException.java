package com.flagship.invoice_ledger.eventsourcing.exception;

/**
 * An event payload or aggregate snapshot could not be written or read as JSON.
 */
public class EventSerializationException extends EventSourcingException {

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
