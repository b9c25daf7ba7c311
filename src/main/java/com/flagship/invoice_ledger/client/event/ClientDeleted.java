package com.flagship.invoice_ledger.client.event;

import java.util.UUID;

/**
 * Tombstone of a client stream.
 */
public record ClientDeleted(UUID clientId) implements ClientEvent {

    @Override
    public ClientEventKind kind() {
        return ClientEventKind.CLIENT_DELETED;
    }
}
