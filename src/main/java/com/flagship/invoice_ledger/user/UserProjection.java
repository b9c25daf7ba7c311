package com.flagship.invoice_ledger.user;

import com.flagship.invoice_ledger.eventsourcing.AggregateProjection;
import com.flagship.invoice_ledger.user.event.UserAccountLocked;
import com.flagship.invoice_ledger.user.event.UserCreated;
import com.flagship.invoice_ledger.user.event.UserEvent;
import com.flagship.invoice_ledger.user.event.UserEventKind;
import com.flagship.invoice_ledger.user.event.UserLoggedIn;
import com.flagship.invoice_ledger.user.event.UserLoggedOut;
import com.flagship.invoice_ledger.user.event.UserLoginFailed;
import com.flagship.invoice_ledger.user.event.UserPasswordChanged;
import com.flagship.invoice_ledger.user.event.UserUpdated;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class UserProjection extends AggregateProjection<User, UserEvent> {

    public static final String AGGREGATE_TYPE = "User";

    public UserProjection() {
        super(AGGREGATE_TYPE, User.class, UserEvent.class, UserEventKind.class);
    }

    @Override
    public User initialState(UUID id) {
        return User.builder().id(id).build();
    }

    @Override
    protected User apply(User state, UserEvent event) {
        return switch (event.kind()) {
            case USER_CREATED -> applyCreated(state, (UserCreated) event);
            case USER_UPDATED -> applyUpdated(state, (UserUpdated) event);
            case USER_LOGGED_IN -> state.toBuilder()
                    .lastLoginAt(((UserLoggedIn) event).loginTime())
                    .failedLoginAttempts(0)
                    .lockedUntil(null)
                    .build();
            case USER_LOGGED_OUT -> state.withLastLogoutAt(((UserLoggedOut) event).logoutTime());
            case USER_LOGIN_FAILED -> state.afterFailedLogin(((UserLoginFailed) event).attemptedAt());
            case USER_PASSWORD_CHANGED -> state.toBuilder()
                    .passwordHash(((UserPasswordChanged) event).newPasswordHash())
                    .salt(((UserPasswordChanged) event).newSalt())
                    .build();
            case USER_ACCOUNT_LOCKED -> state.withLockedUntil(((UserAccountLocked) event).lockedUntil());
            case USER_ACCOUNT_UNLOCKED -> state.toBuilder()
                    .lockedUntil(null)
                    .failedLoginAttempts(0)
                    .build();
            case USER_DELETED -> state;
        };
    }

    private static User applyCreated(User state, UserCreated event) {
        return state.toBuilder()
                .username(event.username())
                .email(event.email())
                .passwordHash(event.passwordHash())
                .salt(event.salt())
                .firstName(event.firstName())
                .lastName(event.lastName())
                .active(true)
                .failedLoginAttempts(0)
                .build();
    }

    private static User applyUpdated(User state, UserUpdated event) {
        return state.toBuilder()
                .username(event.username())
                .email(event.email())
                .firstName(event.firstName())
                .lastName(event.lastName())
                .active(event.active())
                .build();
    }
}
