package com.flagship.invoice_ledger.client;

/**
 * Countries an address can be located in.
 */
public enum Country {
    GERMANY,
    AUSTRIA,
    SWITZERLAND,
    FRANCE,
    NETHERLANDS,
    BELGIUM,
    LUXEMBOURG,
    ITALY,
    POLAND,
    CZECH_REPUBLIC,
    DENMARK
}
