package com.flagship.invoice_ledger.eventsourcing.exception;

import java.util.List;

/**
 * An aggregate failed its own invariants. Raised before any store interaction,
 * so nothing was appended. Carries every violated invariant, not just the first.
 */
public class AggregateValidationException extends EventSourcingException {

    private final String aggregateType;
    private final List<String> errors;

    public AggregateValidationException(String aggregateType, List<String> errors) {
        super(String.format("%s validation failed: %s", aggregateType, String.join(", ", errors)));
        this.aggregateType = aggregateType;
        this.errors = List.copyOf(errors);
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public List<String> getErrors() {
        return errors;
    }
}
