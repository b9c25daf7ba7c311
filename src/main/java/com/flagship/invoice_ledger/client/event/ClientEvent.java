package com.flagship.invoice_ledger.client.event;

import com.flagship.invoice_ledger.eventsourcing.DomainEvent;

/**
 * Events of the client aggregate.
 */
public sealed interface ClientEvent extends DomainEvent
        permits ClientCreated, ClientUpdated, ClientDeleted {

    @Override
    ClientEventKind kind();
}
