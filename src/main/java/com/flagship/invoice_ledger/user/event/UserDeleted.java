package com.flagship.invoice_ledger.user.event;

import java.util.UUID;

/**
 * Tombstone of a user stream.
 */
public record UserDeleted(UUID userId) implements UserEvent {

    @Override
    public UserEventKind kind() {
        return UserEventKind.USER_DELETED;
    }
}
