package com.flagship.invoice_ledger.user.event;

/**
 * A user account was registered. New accounts are active.
 */
public record UserCreated(
        String username,
        String email,
        String passwordHash,
        String salt,
        String firstName,
        String lastName
) implements UserEvent {

    @Override
    public UserEventKind kind() {
        return UserEventKind.USER_CREATED;
    }
}
