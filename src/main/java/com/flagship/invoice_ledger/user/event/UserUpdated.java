package com.flagship.invoice_ledger.user.event;

/**
 * Profile data or the active flag changed. Credentials have their own event.
 */
public record UserUpdated(
        String username,
        String email,
        String firstName,
        String lastName,
        boolean active
) implements UserEvent {

    @Override
    public UserEventKind kind() {
        return UserEventKind.USER_UPDATED;
    }
}
