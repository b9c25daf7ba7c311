package com.flagship.invoice_ledger.user.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Successful sign-in. Clears failed attempts and any lock.
 */
public record UserLoggedIn(UUID userId, Instant loginTime, String source) implements UserEvent {

    @Override
    public UserEventKind kind() {
        return UserEventKind.USER_LOGGED_IN;
    }
}
