package com.flagship.invoice_ledger.user.event;

import java.util.UUID;

/**
 * The password was replaced.
 */
public record UserPasswordChanged(UUID userId, String newPasswordHash, String newSalt) implements UserEvent {

    @Override
    public UserEventKind kind() {
        return UserEventKind.USER_PASSWORD_CHANGED;
    }
}
