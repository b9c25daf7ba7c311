package com.flagship.invoice_ledger.client;

public enum Gender {
    MALE,
    FEMALE
}
