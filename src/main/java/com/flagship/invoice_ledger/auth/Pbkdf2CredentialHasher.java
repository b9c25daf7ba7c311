package com.flagship.invoice_ledger.auth;

import org.springframework.stereotype.Component;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PBKDF2 with HMAC-SHA256, 10000 iterations, 32-byte salt and 32-byte key.
 */
@Component
public class Pbkdf2CredentialHasher implements CredentialHasher {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int ITERATIONS = 10_000;
    private static final int KEY_LENGTH_BITS = 256;
    private static final int SALT_LENGTH_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    @Override
    public HashedCredential hash(String password) {
        byte[] salt = new byte[SALT_LENGTH_BYTES];
        random.nextBytes(salt);
        String encodedSalt = Base64.getEncoder().encodeToString(salt);
        return new HashedCredential(derive(password, salt), encodedSalt);
    }

    @Override
    public boolean verify(String password, HashedCredential credential) {
        if (password == null || credential == null || credential.hash() == null || credential.salt() == null) {
            return false;
        }
        byte[] salt;
        try {
            salt = Base64.getDecoder().decode(credential.salt());
        } catch (IllegalArgumentException e) {
            return false;
        }
        byte[] expected = credential.hash().getBytes(StandardCharsets.US_ASCII);
        byte[] actual = derive(password, salt).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    private static String derive(String password, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, ITERATIONS, KEY_LENGTH_BITS);
        try {
            byte[] key = SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
            return Base64.getEncoder().encodeToString(key);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        } finally {
            spec.clearPassword();
        }
    }
}
