package com.flagship.invoice_ledger.user.event;

import com.flagship.invoice_ledger.eventsourcing.DomainEvent;
import com.flagship.invoice_ledger.eventsourcing.EventKind;

public enum UserEventKind implements EventKind {
    USER_CREATED("UserCreated", UserCreated.class),
    USER_UPDATED("UserUpdated", UserUpdated.class),
    USER_LOGGED_IN("UserLoggedIn", UserLoggedIn.class),
    USER_LOGGED_OUT("UserLoggedOut", UserLoggedOut.class),
    USER_LOGIN_FAILED("UserLoginFailed", UserLoginFailed.class),
    USER_PASSWORD_CHANGED("UserPasswordChanged", UserPasswordChanged.class),
    USER_ACCOUNT_LOCKED("UserAccountLocked", UserAccountLocked.class),
    USER_ACCOUNT_UNLOCKED("UserAccountUnlocked", UserAccountUnlocked.class),
    USER_DELETED("UserDeleted", UserDeleted.class);

    private final String eventName;
    private final Class<? extends UserEvent> eventClass;

    UserEventKind(String eventName, Class<? extends UserEvent> eventClass) {
        this.eventName = eventName;
        this.eventClass = eventClass;
    }

    @Override
    public String eventName() {
        return eventName;
    }

    @Override
    public Class<? extends DomainEvent> eventClass() {
        return eventClass;
    }

    @Override
    public boolean isTombstone() {
        return this == USER_DELETED;
    }
}
