package com.flagship.invoice_ledger.invoice.event;

import com.flagship.invoice_ledger.invoice.InvoiceItem;

import java.util.List;
import java.util.UUID;

/**
 * Items were replaced by id. Unknown ids are appended.
 */
public record InvoiceItemsModified(UUID invoiceId, List<InvoiceItem> items) implements InvoiceEvent {

    public InvoiceItemsModified {
        items = List.copyOf(items);
    }

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.INVOICE_ITEMS_MODIFIED;
    }
}
