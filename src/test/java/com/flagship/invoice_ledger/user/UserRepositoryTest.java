package com.flagship.invoice_ledger.user;

import com.flagship.invoice_ledger.eventsourcing.EventEnvelope;
import com.flagship.invoice_ledger.eventsourcing.exception.AggregateValidationException;
import com.flagship.invoice_ledger.support.InMemoryLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UserRepositoryTest {

    private final InMemoryLedger ledger = new InMemoryLedger();
    private final UserRepository repository = ledger.users;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = repository.add(User.builder()
                .username("jdoe")
                .email("John.Doe@example.com")
                .passwordHash("hash")
                .salt("salt")
                .firstName("John")
                .lastName("Doe")
                .build()).join();
    }

    private User load() {
        return repository.getById(userId).join().orElseThrow();
    }

    @Test
    @DisplayName("a user without credentials is rejected")
    void validation() {
        AggregateValidationException e = assertThrows(AggregateValidationException.class,
                () -> repository.add(User.builder().username(" ").build()));

        assertEquals(List.of("Username is required.", "Email is required.", "Password hash is required."),
                e.getErrors());
    }

    @Test
    @DisplayName("lookups by username and by email are exact")
    void lookups() {
        assertEquals(userId, repository.getByUsername("jdoe").join().orElseThrow().getId());
        assertTrue(repository.getByUsername("JDOE").join().isEmpty());
        assertEquals(userId, repository.getByEmail("John.Doe@example.com").join().orElseThrow().getId());
        assertTrue(repository.getByEmail("john.doe@EXAMPLE.com").join().isEmpty());
        assertTrue(repository.getByEmail(null).join().isEmpty());
    }

    @Nested
    @DisplayName("Failed logins")
    class FailedLogins {

        @Test
        @DisplayName("the fifth failure locks the account for fifteen minutes")
        void locksAfterFiveFailures() {
            for (int i = 0; i < User.MAX_FAILED_LOGIN_ATTEMPTS - 1; i++) {
                repository.recordFailedLogin(userId).join();
            }
            assertEquals(4, load().getFailedLoginAttempts());
            assertNull(load().getLockedUntil());

            long version = repository.recordFailedLogin(userId).join();

            User locked = load();
            assertEquals(6, version);
            assertEquals(5, locked.getFailedLoginAttempts());
            assertEquals(InMemoryLedger.START.plus(User.LOCK_DURATION), locked.getLockedUntil());
            assertTrue(locked.isLocked(ledger.clock.instant()));
            assertEquals(List.of("UserLoginFailed"), repository.loadStream(userId).join()
                    .subList(5, 6).stream()
                    .map(EventEnvelope::getEventName)
                    .toList());
        }

        @Test
        @DisplayName("a lock expires with time")
        void lockExpires() {
            repository.lockAccount(userId, ledger.clock.instant().plus(Duration.ofMinutes(15)), "Manual").join();
            User locked = load();

            assertTrue(locked.isLocked(ledger.clock.instant()));
            ledger.clock.advance(Duration.ofMinutes(15));
            assertFalse(locked.isLocked(ledger.clock.instant()));
        }

        @Test
        @DisplayName("failures seen from an outdated copy of the user are still counted")
        void staleFailure() {
            User stale = load();
            repository.recordFailedLogin(stale.getId()).join();
            repository.recordFailedLogin(stale.getId()).join();

            assertEquals(2, load().getFailedLoginAttempts());
            assertEquals(stale.getVersion() + 2, load().getVersion());
        }

        @Test
        @DisplayName("after a lock expires the next failure starts a fresh count")
        void failureAfterExpiredLock() {
            for (int i = 0; i < User.MAX_FAILED_LOGIN_ATTEMPTS; i++) {
                repository.recordFailedLogin(userId).join();
            }
            assertTrue(load().isLocked(ledger.clock.instant()));

            ledger.clock.advance(Duration.ofMinutes(16));
            repository.recordFailedLogin(userId).join();

            User user = load();
            assertFalse(user.isLocked(ledger.clock.instant()));
            assertNull(user.getLockedUntil());
            assertEquals(1, user.getFailedLoginAttempts());
        }

        @Test
        @DisplayName("failures while locked keep the original lock end")
        void failureWhileLocked() {
            for (int i = 0; i < User.MAX_FAILED_LOGIN_ATTEMPTS; i++) {
                repository.recordFailedLogin(userId).join();
            }
            ledger.clock.advance(Duration.ofMinutes(5));

            repository.recordFailedLogin(userId).join();

            User user = load();
            assertEquals(InMemoryLedger.START.plus(User.LOCK_DURATION), user.getLockedUntil());
            assertEquals(6, user.getFailedLoginAttempts());
        }

        @Test
        @DisplayName("unlocking clears the lock and the counter")
        void unlock() {
            for (int i = 0; i < User.MAX_FAILED_LOGIN_ATTEMPTS; i++) {
                repository.recordFailedLogin(userId).join();
            }

            repository.unlockAccount(userId).join();

            User unlocked = load();
            assertNull(unlocked.getLockedUntil());
            assertEquals(0, unlocked.getFailedLoginAttempts());
        }
    }

    @Nested
    @DisplayName("Sessions")
    class Sessions {

        @Test
        @DisplayName("a successful login resets failures and stamps the time")
        void loginResetsFailures() {
            repository.recordFailedLogin(userId).join();
            repository.recordFailedLogin(userId).join();
            ledger.clock.advance(Duration.ofMinutes(1));
            Instant loginTime = ledger.clock.instant();

            repository.recordSuccessfulLogin(userId, null).join();

            User user = load();
            assertEquals(0, user.getFailedLoginAttempts());
            assertEquals(loginTime, user.getLastLoginAt());
        }

        @Test
        @DisplayName("logout stamps the logout time")
        void logout() {
            repository.recordSuccessfulLogin(userId, "sso").join();
            ledger.clock.advance(Duration.ofHours(8));

            repository.recordLogout(userId).join();

            assertEquals(InMemoryLedger.START.plus(Duration.ofHours(8)), load().getLastLogoutAt());
            assertEquals(InMemoryLedger.START, load().getLastLoginAt());
        }
    }

    @Test
    @DisplayName("a password change replaces hash and salt")
    void changePassword() {
        repository.changePassword(load(), "new-hash", "new-salt").join();

        User user = load();
        assertEquals("new-hash", user.getPasswordHash());
        assertEquals("new-salt", user.getSalt());
        assertThrows(IllegalArgumentException.class, () -> repository.changePassword(user, "", "salt"));
    }

    @Test
    @DisplayName("a deactivated user keeps its stream but reads as inactive")
    void deactivate() {
        repository.update(load().withActive(false)).join();

        assertFalse(load().isActive());
        assertEquals("John Doe", load().getFullName());
    }
}
