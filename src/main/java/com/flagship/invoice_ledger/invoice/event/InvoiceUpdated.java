package com.flagship.invoice_ledger.invoice.event;

import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.InvoiceItem;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * The invoice's data and items were replaced. Status and expense proof files
 * have events of their own and are left as they are.
 */
public record InvoiceUpdated(
        String invoiceNumber,
        LocalDate invoiceDate,
        LocalDate dueDate,
        LocalDate serviceDate,
        BigDecimal totalAmount,
        UUID clientId,
        List<InvoiceItem> items
) implements InvoiceEvent {

    public InvoiceUpdated {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static InvoiceUpdated of(Invoice invoice) {
        return new InvoiceUpdated(
                invoice.getInvoiceNumber(),
                invoice.getInvoiceDate(),
                invoice.getDueDate(),
                invoice.getServiceDate(),
                invoice.getTotalAmount(),
                invoice.getClientId(),
                invoice.getItems());
    }

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.INVOICE_UPDATED;
    }
}
