package com.flagship.invoice_ledger.auth;

import com.flagship.invoice_ledger.user.User;
import com.flagship.invoice_ledger.user.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Sign-in, sign-out, registration and password changes on top of the user
 * event stream.
 *
 * Every outcome of a sign-in is recorded as a user event: a wrong password counts
 * towards the lock, a success resets the counter.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthenticationService {

    private static final DateTimeFormatter LOCK_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;
    private final Clock clock;

    /**
     * Checks the credentials in this order: known user, active, not locked,
     * password. Only a wrong password for a known user is recorded as a failed
     * attempt.
     */
    public CompletableFuture<LoginResult> login(String username, String password) {
        return userRepository.getByUsername(username).thenCompose(found -> {
            if (found.isEmpty()) {
                log.warn("Login failed: unknown username '{}'", username);
                return CompletableFuture.completedFuture(LoginResult.failure(LoginResult.INVALID_CREDENTIALS_MESSAGE));
            }
            User user = found.get();
            if (!user.isActive()) {
                log.warn("Login refused: user {} is deactivated", user.getId());
                return CompletableFuture.completedFuture(LoginResult.failure(LoginResult.DEACTIVATED_MESSAGE));
            }
            if (user.isLocked(clock.instant())) {
                log.warn("Login refused: user {} is locked until {}", user.getId(), user.getLockedUntil());
                return CompletableFuture.completedFuture(LoginResult.failure(
                        "Account is locked until " + LOCK_TIME_FORMAT.format(user.getLockedUntil()) + "."));
            }
            if (!credentialHasher.verify(password, new HashedCredential(user.getPasswordHash(), user.getSalt()))) {
                log.warn("Login failed: wrong password for user {}", user.getId());
                return userRepository.recordFailedLogin(user.getId())
                        .thenApply(version -> LoginResult.failure(LoginResult.INVALID_CREDENTIALS_MESSAGE));
            }
            return userRepository.recordSuccessfulLogin(user.getId(), UserRepository.LOCAL_LOGIN_SOURCE)
                    .thenApply(version -> {
                        log.info("User {} logged in", user.getId());
                        return LoginResult.success(user);
                    });
        });
    }

    public CompletableFuture<Void> logout(UUID userId) {
        return userRepository.recordLogout(userId)
                .thenAccept(version -> log.info("User {} logged out", userId));
    }

    /**
     * Registers a new, active user.
     *
     * @return id of the new user
     */
    public CompletableFuture<UUID> register(String username, String email, String password,
                                            String firstName, String lastName) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password is required");
        }
        HashedCredential credential = credentialHasher.hash(password);
        User user = User.builder()
                .id(UUID.randomUUID())
                .username(username)
                .email(email)
                .passwordHash(credential.hash())
                .salt(credential.salt())
                .firstName(firstName)
                .lastName(lastName)
                .build();
        return userRepository.add(user);
    }

    /**
     * Replaces the password after checking the current one.
     *
     * @return false when the user does not exist or the current password is wrong
     */
    public CompletableFuture<Boolean> changePassword(UUID userId, String currentPassword, String newPassword) {
        if (newPassword == null || newPassword.isEmpty()) {
            throw new IllegalArgumentException("New password is required");
        }
        return userRepository.getById(userId).thenCompose(found -> {
            if (found.isEmpty()) {
                return CompletableFuture.completedFuture(false);
            }
            User user = found.get();
            if (!credentialHasher.verify(currentPassword, new HashedCredential(user.getPasswordHash(), user.getSalt()))) {
                log.warn("Password change refused for user {}: current password does not match", userId);
                return CompletableFuture.completedFuture(false);
            }
            HashedCredential credential = credentialHasher.hash(newPassword);
            return userRepository.changePassword(user, credential.hash(), credential.salt())
                    .thenApply(version -> true);
        });
    }
}
