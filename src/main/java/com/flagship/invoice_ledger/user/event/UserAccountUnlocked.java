package com.flagship.invoice_ledger.user.event;

import java.util.UUID;

/**
 * Lock lifted and failed attempts reset.
 */
public record UserAccountUnlocked(UUID userId) implements UserEvent {

    @Override
    public UserEventKind kind() {
        return UserEventKind.USER_ACCOUNT_UNLOCKED;
    }
}
