package com.flagship.invoice_ledger.eventsourcing.exception;

/**
 * Base class for failures raised by the event sourcing core.
 */
public abstract class EventSourcingException extends RuntimeException {

    protected EventSourcingException(String message) {
        super(message);
    }

    protected EventSourcingException(String message, Throwable cause) {
        super(message, cause);
    }
}
