package com.flagship.invoice_ledger.client.event;

import com.flagship.invoice_ledger.eventsourcing.DomainEvent;
import com.flagship.invoice_ledger.eventsourcing.EventKind;

public enum ClientEventKind implements EventKind {
    CLIENT_CREATED("ClientCreated", ClientCreated.class, false),
    CLIENT_UPDATED("ClientUpdated", ClientUpdated.class, false),
    CLIENT_DELETED("ClientDeleted", ClientDeleted.class, true);

    private final String eventName;
    private final Class<? extends ClientEvent> eventClass;
    private final boolean tombstone;

    ClientEventKind(String eventName, Class<? extends ClientEvent> eventClass, boolean tombstone) {
        this.eventName = eventName;
        this.eventClass = eventClass;
        this.tombstone = tombstone;
    }

    @Override
    public String eventName() {
        return eventName;
    }

    @Override
    public Class<? extends DomainEvent> eventClass() {
        return eventClass;
    }

    @Override
    public boolean isTombstone() {
        return tombstone;
    }
}
