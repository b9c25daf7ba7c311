package com.flagship.invoice_ledger.invoice.event;

import com.flagship.invoice_ledger.eventsourcing.DomainEvent;

/**
 * Events of the invoice aggregate.
 */
public sealed interface InvoiceEvent extends DomainEvent
        permits InvoiceCreated, InvoiceUpdated, InvoiceStatusChanged,
        InvoiceItemsAdded, InvoiceItemsModified, InvoiceItemsDeleted,
        ExpenseProofFilesAdded, ExpenseProofFilesModified, ExpenseProofFilesDeleted,
        InvoiceDeleted {

    @Override
    InvoiceEventKind kind();
}
