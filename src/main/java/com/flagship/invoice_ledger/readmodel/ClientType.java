package com.flagship.invoice_ledger.readmodel;

public enum ClientType {
    INDIVIDUAL,
    COMPANY
}
