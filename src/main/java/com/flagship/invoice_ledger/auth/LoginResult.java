package com.flagship.invoice_ledger.auth;

import com.flagship.invoice_ledger.user.User;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a sign-in attempt. The user is only present on success.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoginResult {

    public static final String SUCCESS_MESSAGE = "Login successful.";
    public static final String INVALID_CREDENTIALS_MESSAGE = "Invalid username or password.";
    public static final String DEACTIVATED_MESSAGE = "Account is deactivated. Please contact support.";

    boolean success;
    String message;
    User user;

    public static LoginResult success(User user) {
        return new LoginResult(true, SUCCESS_MESSAGE, user);
    }

    public static LoginResult failure(String message) {
        return new LoginResult(false, message, null);
    }

    public Optional<User> user() {
        return Optional.ofNullable(user);
    }
}
