package com.flagship.invoice_ledger.invoice.event;

import com.flagship.invoice_ledger.invoice.InvoiceItem;

import java.util.List;
import java.util.UUID;

/**
 * Items were appended to the invoice. Items whose id is already present are skipped.
 */
public record InvoiceItemsAdded(UUID invoiceId, List<InvoiceItem> items) implements InvoiceEvent {

    public InvoiceItemsAdded {
        items = List.copyOf(items);
    }

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.INVOICE_ITEMS_ADDED;
    }
}
