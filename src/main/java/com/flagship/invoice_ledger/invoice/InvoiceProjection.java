package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.eventsourcing.AggregateProjection;
import com.flagship.invoice_ledger.eventsourcing.SubItems;
import com.flagship.invoice_ledger.invoice.event.ExpenseProofFilesAdded;
import com.flagship.invoice_ledger.invoice.event.ExpenseProofFilesDeleted;
import com.flagship.invoice_ledger.invoice.event.ExpenseProofFilesModified;
import com.flagship.invoice_ledger.invoice.event.InvoiceCreated;
import com.flagship.invoice_ledger.invoice.event.InvoiceEvent;
import com.flagship.invoice_ledger.invoice.event.InvoiceEventKind;
import com.flagship.invoice_ledger.invoice.event.InvoiceItemsAdded;
import com.flagship.invoice_ledger.invoice.event.InvoiceItemsDeleted;
import com.flagship.invoice_ledger.invoice.event.InvoiceItemsModified;
import com.flagship.invoice_ledger.invoice.event.InvoiceStatusChanged;
import com.flagship.invoice_ledger.invoice.event.InvoiceUpdated;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class InvoiceProjection extends AggregateProjection<Invoice, InvoiceEvent> {

    public static final String AGGREGATE_TYPE = "Invoice";

    public InvoiceProjection() {
        super(AGGREGATE_TYPE, Invoice.class, InvoiceEvent.class, InvoiceEventKind.class);
    }

    @Override
    public Invoice initialState(UUID id) {
        return Invoice.builder().id(id).build();
    }

    @Override
    protected Invoice apply(Invoice state, InvoiceEvent event) {
        return switch (event.kind()) {
            case INVOICE_CREATED -> applyCreated(state, (InvoiceCreated) event);
            case INVOICE_UPDATED -> applyUpdated(state, (InvoiceUpdated) event);
            case INVOICE_STATUS_CHANGED -> applyStatusChanged(state, (InvoiceStatusChanged) event);
            case INVOICE_ITEMS_ADDED -> state.withItems(
                    SubItems.add(state.getItems(), ((InvoiceItemsAdded) event).items()));
            case INVOICE_ITEMS_MODIFIED -> state.withItems(
                    SubItems.modify(state.getItems(), ((InvoiceItemsModified) event).items()));
            case INVOICE_ITEMS_DELETED -> state.withItems(
                    SubItems.delete(state.getItems(), ((InvoiceItemsDeleted) event).itemIds()));
            case EXPENSE_PROOF_FILES_ADDED -> state.withExpenseProofFiles(
                    SubItems.add(state.getExpenseProofFiles(), ((ExpenseProofFilesAdded) event).files()));
            case EXPENSE_PROOF_FILES_MODIFIED -> state.withExpenseProofFiles(
                    SubItems.modify(state.getExpenseProofFiles(), ((ExpenseProofFilesModified) event).files()));
            case EXPENSE_PROOF_FILES_DELETED -> state.withExpenseProofFiles(
                    SubItems.delete(state.getExpenseProofFiles(), ((ExpenseProofFilesDeleted) event).fileIds()));
            case INVOICE_DELETED -> state;
        };
    }

    private static Invoice applyCreated(Invoice state, InvoiceCreated event) {
        return state.toBuilder()
                .invoiceNumber(event.invoiceNumber())
                .invoiceDate(event.invoiceDate())
                .dueDate(event.dueDate())
                .serviceDate(event.serviceDate())
                .totalAmount(event.totalAmount())
                .clientId(event.clientId())
                .items(event.items())
                .status(event.status())
                .paidDate(event.paidDate())
                .paymentNotes(event.paymentNotes())
                .expenseProofFiles(event.expenseProofFiles())
                .build();
    }

    private static Invoice applyUpdated(Invoice state, InvoiceUpdated event) {
        return state.toBuilder()
                .invoiceNumber(event.invoiceNumber())
                .invoiceDate(event.invoiceDate())
                .dueDate(event.dueDate())
                .serviceDate(event.serviceDate())
                .totalAmount(event.totalAmount())
                .clientId(event.clientId())
                .items(event.items())
                .build();
    }

    private static Invoice applyStatusChanged(Invoice state, InvoiceStatusChanged event) {
        String notes = event.paymentNotes();
        return state.toBuilder()
                .status(event.newStatus())
                .paidDate(event.paidDate())
                .paymentNotes(notes != null && !notes.isBlank() ? notes : state.getPaymentNotes())
                .build();
    }
}
