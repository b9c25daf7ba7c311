package com.flagship.invoice_ledger.user;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.invoice_ledger.eventsourcing.AggregateRoot;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An account that can sign in to the application.
 * The password is only ever held as a salted hash.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class User implements AggregateRoot<User> {

    public static final int MAX_FAILED_LOGIN_ATTEMPTS = 5;
    public static final Duration LOCK_DURATION = Duration.ofMinutes(15);

    UUID id;
    long version;
    Instant createdOn;
    Instant modifiedOn;

    String username;
    String email;
    String passwordHash;
    String salt;
    String firstName;
    String lastName;
    @Builder.Default
    boolean active = true;
    Instant lastLoginAt;
    Instant lastLogoutAt;
    Instant lockedUntil;
    int failedLoginAttempts;

    @JsonIgnore
    public String getFullName() {
        return Stream.of(firstName, lastName)
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(" "));
    }

    public boolean isLocked(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    /**
     * State after a wrong password at the given time. Failures are counted since
     * the last lock expired; the attempt that reaches
     * {@link #MAX_FAILED_LOGIN_ATTEMPTS} locks the account for {@link #LOCK_DURATION}.
     * An account that is still locked keeps its lock end.
     */
    public User afterFailedLogin(Instant attemptedAt) {
        boolean lockExpired = lockedUntil != null && !lockedUntil.isAfter(attemptedAt);
        int attempts = lockExpired ? 1 : failedLoginAttempts + 1;
        Instant lockEnd = lockExpired ? null : lockedUntil;
        if (lockEnd == null && attempts >= MAX_FAILED_LOGIN_ATTEMPTS) {
            lockEnd = attemptedAt.plus(LOCK_DURATION);
        }
        return toBuilder()
                .failedLoginAttempts(attempts)
                .lockedUntil(lockEnd)
                .build();
    }

    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();
        if (username == null || username.isBlank()) {
            errors.add("Username is required.");
        }
        if (email == null || email.isBlank()) {
            errors.add("Email is required.");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            errors.add("Password hash is required.");
        }
        return errors;
    }
}
