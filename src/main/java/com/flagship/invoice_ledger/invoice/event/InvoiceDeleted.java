package com.flagship.invoice_ledger.invoice.event;

import java.util.UUID;

/**
 * Tombstone of an invoice stream.
 */
public record InvoiceDeleted(UUID invoiceId) implements InvoiceEvent {

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.INVOICE_DELETED;
    }
}
