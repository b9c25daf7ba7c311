package com.flagship.invoice_ledger.auth;

/**
 * Turns passwords into salted hashes and checks passwords against them.
 */
public interface CredentialHasher {

    /**
     * Hashes the password with a freshly generated salt.
     */
    HashedCredential hash(String password);

    boolean verify(String password, HashedCredential credential);
}
