package com.flagship.invoice_ledger.user.event;

import java.time.Instant;
import java.util.UUID;

/**
 * The user signed out.
 */
public record UserLoggedOut(UUID userId, Instant logoutTime) implements UserEvent {

    @Override
    public UserEventKind kind() {
        return UserEventKind.USER_LOGGED_OUT;
    }
}
