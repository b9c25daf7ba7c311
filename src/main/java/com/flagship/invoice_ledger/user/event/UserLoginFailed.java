package com.flagship.invoice_ledger.user.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A sign-in attempt with a wrong password.
 */
public record UserLoginFailed(UUID userId, Instant attemptedAt) implements UserEvent {

    @Override
    public UserEventKind kind() {
        return UserEventKind.USER_LOGIN_FAILED;
    }
}
