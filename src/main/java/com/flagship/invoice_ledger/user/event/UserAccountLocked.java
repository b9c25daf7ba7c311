package com.flagship.invoice_ledger.user.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Sign-in is refused until the given time.
 */
public record UserAccountLocked(UUID userId, Instant lockedUntil, String reason) implements UserEvent {

    @Override
    public UserEventKind kind() {
        return UserEventKind.USER_ACCOUNT_LOCKED;
    }
}
