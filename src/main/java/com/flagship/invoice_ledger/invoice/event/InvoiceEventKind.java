package com.flagship.invoice_ledger.invoice.event;

import com.flagship.invoice_ledger.eventsourcing.DomainEvent;
import com.flagship.invoice_ledger.eventsourcing.EventKind;

public enum InvoiceEventKind implements EventKind {
    INVOICE_CREATED("InvoiceCreated", InvoiceCreated.class),
    INVOICE_UPDATED("InvoiceUpdated", InvoiceUpdated.class),
    INVOICE_STATUS_CHANGED("InvoiceStatusChanged", InvoiceStatusChanged.class),
    INVOICE_ITEMS_ADDED("InvoiceItemsAdded", InvoiceItemsAdded.class),
    INVOICE_ITEMS_MODIFIED("InvoiceItemsModified", InvoiceItemsModified.class),
    INVOICE_ITEMS_DELETED("InvoiceItemsDeleted", InvoiceItemsDeleted.class),
    EXPENSE_PROOF_FILES_ADDED("ExpenseProofFilesAdded", ExpenseProofFilesAdded.class),
    EXPENSE_PROOF_FILES_MODIFIED("ExpenseProofFilesModified", ExpenseProofFilesModified.class),
    EXPENSE_PROOF_FILES_DELETED("ExpenseProofFilesDeleted", ExpenseProofFilesDeleted.class),
    INVOICE_DELETED("InvoiceDeleted", InvoiceDeleted.class);

    private final String eventName;
    private final Class<? extends InvoiceEvent> eventClass;

    InvoiceEventKind(String eventName, Class<? extends InvoiceEvent> eventClass) {
        this.eventName = eventName;
        this.eventClass = eventClass;
    }

    @Override
    public String eventName() {
        return eventName;
    }

    @Override
    public Class<? extends DomainEvent> eventClass() {
        return eventClass;
    }

    @Override
    public boolean isTombstone() {
        return this == INVOICE_DELETED;
    }
}
