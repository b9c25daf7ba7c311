package com.flagship.invoice_ledger.invoice;

/**
 * How an invoice item is priced.
 */
public enum BillingType {
    /** quantity is hours, unit price per hour */
    PER_HOUR,
    /** area times price per square meter */
    PER_SQUARE_METER,
    /** a single fixed amount */
    FIXED_PRICE,
    /** quantity is a number of objects, unit price per object */
    PER_OBJECT
}
