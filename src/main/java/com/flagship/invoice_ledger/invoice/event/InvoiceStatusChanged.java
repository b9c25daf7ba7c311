package com.flagship.invoice_ledger.invoice.event;

import com.flagship.invoice_ledger.invoice.InvoiceStatus;

import java.time.LocalDate;
import java.util.UUID;

/**
 * The invoice moved to a new status.
 *
 * @param paidDate     paid date from now on; null unless the new status is PAID
 * @param paymentNotes replaces the current notes unless blank
 */
public record InvoiceStatusChanged(
        UUID invoiceId,
        InvoiceStatus newStatus,
        InvoiceStatus previousStatus,
        LocalDate paidDate,
        String paymentNotes
) implements InvoiceEvent {

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.INVOICE_STATUS_CHANGED;
    }
}
