package com.flagship.invoice_ledger.user.event;

import com.flagship.invoice_ledger.eventsourcing.DomainEvent;

/**
 * Events of the user aggregate.
 */
public sealed interface UserEvent extends DomainEvent
        permits UserCreated, UserUpdated, UserLoggedIn, UserLoggedOut, UserLoginFailed,
        UserPasswordChanged, UserAccountLocked, UserAccountUnlocked, UserDeleted {

    @Override
    UserEventKind kind();
}
