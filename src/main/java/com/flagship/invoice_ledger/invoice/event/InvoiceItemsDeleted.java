package com.flagship.invoice_ledger.invoice.event;

import java.util.List;
import java.util.UUID;

/**
 * Items were removed. Unknown ids are ignored.
 */
public record InvoiceItemsDeleted(UUID invoiceId, List<UUID> itemIds) implements InvoiceEvent {

    public InvoiceItemsDeleted {
        itemIds = List.copyOf(itemIds);
    }

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.INVOICE_ITEMS_DELETED;
    }
}
