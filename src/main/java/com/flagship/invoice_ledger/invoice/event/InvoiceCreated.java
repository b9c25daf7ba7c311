package com.flagship.invoice_ledger.invoice.event;

import com.flagship.invoice_ledger.invoice.ExpenseProofFile;
import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.InvoiceItem;
import com.flagship.invoice_ledger.invoice.InvoiceStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * An invoice was created with its items, expense proof files and initial status.
 */
public record InvoiceCreated(
        String invoiceNumber,
        LocalDate invoiceDate,
        LocalDate dueDate,
        LocalDate serviceDate,
        BigDecimal totalAmount,
        UUID clientId,
        List<InvoiceItem> items,
        InvoiceStatus status,
        LocalDate paidDate,
        String paymentNotes,
        List<ExpenseProofFile> expenseProofFiles
) implements InvoiceEvent {

    public InvoiceCreated {
        items = items != null ? List.copyOf(items) : List.of();
        expenseProofFiles = expenseProofFiles != null ? List.copyOf(expenseProofFiles) : List.of();
        status = status != null ? status : InvoiceStatus.DRAFT;
    }

    public static InvoiceCreated of(Invoice invoice) {
        return new InvoiceCreated(
                invoice.getInvoiceNumber(),
                invoice.getInvoiceDate(),
                invoice.getDueDate(),
                invoice.getServiceDate(),
                invoice.getTotalAmount(),
                invoice.getClientId(),
                invoice.getItems(),
                invoice.getStatus(),
                invoice.getPaidDate(),
                invoice.getPaymentNotes(),
                invoice.getExpenseProofFiles());
    }

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.INVOICE_CREATED;
    }
}
