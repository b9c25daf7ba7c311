package com.flagship.invoice_ledger.auth;

/**
 * A password hash and the salt it was derived with, both Base64.
 */
public record HashedCredential(String hash, String salt) {
}
