package com.flagship.invoice_ledger.user;

import com.flagship.invoice_ledger.eventsourcing.AggregateRepository;
import com.flagship.invoice_ledger.eventstore.EventStore;
import com.flagship.invoice_ledger.eventstore.ExpectedVersion;
import com.flagship.invoice_ledger.observability.EventStoreMetrics;
import com.flagship.invoice_ledger.user.event.UserAccountLocked;
import com.flagship.invoice_ledger.user.event.UserAccountUnlocked;
import com.flagship.invoice_ledger.user.event.UserCreated;
import com.flagship.invoice_ledger.user.event.UserDeleted;
import com.flagship.invoice_ledger.user.event.UserEvent;
import com.flagship.invoice_ledger.user.event.UserLoggedIn;
import com.flagship.invoice_ledger.user.event.UserLoggedOut;
import com.flagship.invoice_ledger.user.event.UserLoginFailed;
import com.flagship.invoice_ledger.user.event.UserPasswordChanged;
import com.flagship.invoice_ledger.user.event.UserUpdated;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Persistence of user accounts as event streams, including the sign-in history
 * that drives account locking.
 */
@Component
@Slf4j
public class UserRepository extends AggregateRepository<User, UserEvent> {

    public static final String LOCAL_LOGIN_SOURCE = "local";

    private final Clock clock;

    public UserRepository(EventStore eventStore,
                          UserProjection projection,
                          @Qualifier("eventStoreExecutor") Executor executor,
                          EventStoreMetrics metrics,
                          Clock clock) {
        super(eventStore, projection, executor, metrics);
        this.clock = clock;
    }

    public CompletableFuture<Optional<User>> getByUsername(String username) {
        if (username == null || username.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return queryAsync(user -> username.equals(user.getUsername()))
                .thenApply(users -> users.stream().findFirst());
    }

    public CompletableFuture<Optional<User>> getByEmail(String email) {
        if (email == null || email.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return queryAsync(user -> email.equals(user.getEmail()))
                .thenApply(users -> users.stream().findFirst());
    }

    public CompletableFuture<Long> recordSuccessfulLogin(UUID userId, String source) {
        requireId(userId);
        UserLoggedIn event = new UserLoggedIn(userId, clock.instant(), source != null ? source : LOCAL_LOGIN_SOURCE);
        return appendEvents(userId, ExpectedVersion.any(), List.of(event));
    }

    public CompletableFuture<Long> recordLogout(UUID userId) {
        requireId(userId);
        return appendEvents(userId, ExpectedVersion.any(), List.of(new UserLoggedOut(userId, clock.instant())));
    }

    /**
     * Records a wrong password. Appends without a version check so that parallel
     * attempts are all counted; the lock itself is derived when the stream is folded
     * (see {@link User#afterFailedLogin}).
     */
    public CompletableFuture<Long> recordFailedLogin(UUID userId) {
        requireId(userId);
        return appendEvents(userId, ExpectedVersion.any(), List.of(new UserLoginFailed(userId, clock.instant())));
    }

    /**
     * Stores a new password hash for a loaded user.
     */
    public CompletableFuture<Long> changePassword(User user, String newPasswordHash, String newSalt) {
        requireLoaded(user);
        if (newPasswordHash == null || newPasswordHash.isBlank()) {
            throw new IllegalArgumentException("Password hash is required");
        }
        log.info("Changing password of user {}", user.getUsername());
        return appendEvents(user.getId(), ExpectedVersion.exactly(user.getVersion()),
                List.of(new UserPasswordChanged(user.getId(), newPasswordHash, newSalt)));
    }

    public CompletableFuture<Long> lockAccount(UUID userId, Instant lockedUntil, String reason) {
        requireId(userId);
        if (lockedUntil == null) {
            throw new IllegalArgumentException("Lock end is required");
        }
        return appendEvents(userId, ExpectedVersion.any(), List.of(new UserAccountLocked(userId, lockedUntil, reason)));
    }

    public CompletableFuture<Long> unlockAccount(UUID userId) {
        requireId(userId);
        return appendEvents(userId, ExpectedVersion.any(), List.of(new UserAccountUnlocked(userId)));
    }

    @Override
    protected List<String> validate(User user) {
        return user.validationErrors();
    }

    @Override
    protected UserEvent createdEvent(User user) {
        return new UserCreated(user.getUsername(), user.getEmail(), user.getPasswordHash(), user.getSalt(),
                user.getFirstName(), user.getLastName());
    }

    @Override
    protected UserEvent updatedEvent(User user) {
        return new UserUpdated(user.getUsername(), user.getEmail(), user.getFirstName(), user.getLastName(),
                user.isActive());
    }

    @Override
    protected UserEvent deletedEvent(UUID id) {
        return new UserDeleted(id);
    }

    @Override
    protected Comparator<User> displayOrder() {
        return Comparator.comparing(User::getUsername, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(User::getId);
    }
}
