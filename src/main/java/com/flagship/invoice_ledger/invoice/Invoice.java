package com.flagship.invoice_ledger.invoice;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.invoice_ledger.eventsourcing.AggregateRoot;
import com.flagship.invoice_ledger.eventsourcing.SubItemChanges;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * An invoice for one client.
 *
 * Money flows:
 * - itemsTotal: what is charged for the items
 * - expensesTotal: expenses backed by proof files
 * - netTotal: itemsTotal minus expensesTotal
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class Invoice implements AggregateRoot<Invoice> {

    public static final String INVOICE_NUMBER_PREFIX = "RN-";
    public static final int DEFAULT_PAYMENT_TERM_DAYS = 14;
    public static final int DUE_SOON_DAYS = 7;

    UUID id;
    long version;
    Instant createdOn;
    Instant modifiedOn;

    @Builder.Default
    String invoiceNumber = INVOICE_NUMBER_PREFIX;
    LocalDate invoiceDate;
    LocalDate dueDate;
    LocalDate serviceDate;
    @Builder.Default
    BigDecimal totalAmount = BigDecimal.ZERO;

    @Builder.Default
    InvoiceStatus status = InvoiceStatus.DRAFT;
    LocalDate paidDate;
    String paymentNotes;

    UUID clientId;
    @Builder.Default
    List<InvoiceItem> items = List.of();
    @Builder.Default
    List<ExpenseProofFile> expenseProofFiles = List.of();

    /**
     * A new draft for a client: dated today, due after the default payment term,
     * service a week ago.
     */
    public static Invoice draft(UUID clientId, LocalDate today) {
        return Invoice.builder()
                .clientId(clientId)
                .invoiceDate(today)
                .dueDate(today.plusDays(DEFAULT_PAYMENT_TERM_DAYS))
                .serviceDate(today.minusDays(7))
                .build();
    }

    @JsonIgnore
    public BigDecimal getItemsTotal() {
        return items.stream()
                .map(InvoiceItem::getTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @JsonIgnore
    public BigDecimal getExpensesTotal() {
        return expenseProofFiles.stream()
                .map(ExpenseProofFile::getAmount)
                .filter(amount -> amount != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @JsonIgnore
    public BigDecimal getNetTotal() {
        return getItemsTotal().subtract(getExpensesTotal());
    }

    /**
     * Status as seen on the given day: a sent invoice past its due date is overdue.
     */
    public InvoiceStatus effectiveStatus(LocalDate today) {
        if (status == InvoiceStatus.SENT && dueDate != null && dueDate.isBefore(today)) {
            return InvoiceStatus.OVERDUE;
        }
        return status;
    }

    public boolean isOverdue(LocalDate today) {
        return effectiveStatus(today) == InvoiceStatus.OVERDUE;
    }

    /**
     * Unpaid, not cancelled and due within the next week (today included).
     */
    public boolean isDueSoon(LocalDate today) {
        if (status == InvoiceStatus.PAID || status == InvoiceStatus.CANCELLED || dueDate == null) {
            return false;
        }
        long daysUntilDue = ChronoUnit.DAYS.between(today, dueDate);
        return daysUntilDue >= 0 && daysUntilDue <= DUE_SOON_DAYS;
    }

    /**
     * Paid date after a status change: a payment keeps the date already recorded,
     * otherwise takes the given date or today. Any other status has no paid date.
     */
    public LocalDate paidDateAfterStatusChange(InvoiceStatus newStatus, LocalDate requestedPaidDate, LocalDate today) {
        if (newStatus != InvoiceStatus.PAID) {
            return null;
        }
        if (paidDate != null) {
            return paidDate;
        }
        return requestedPaidDate != null ? requestedPaidDate : today;
    }

    public SubItemChanges<InvoiceItem> itemChangesFrom(Invoice previous) {
        return SubItemChanges.between(previous != null ? previous.getItems() : List.of(), items);
    }

    public SubItemChanges<ExpenseProofFile> expenseProofFileChangesFrom(Invoice previous) {
        return SubItemChanges.between(previous != null ? previous.getExpenseProofFiles() : List.of(), expenseProofFiles);
    }

    /**
     * Every violated invariant; invoice-level messages first, then item messages
     * in item order.
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();
        if (items == null || items.isEmpty()) {
            errors.add("Invoice must have at least one item.");
        }
        if (invoiceNumber == null || invoiceNumber.isBlank() || INVOICE_NUMBER_PREFIX.equals(invoiceNumber)) {
            errors.add("Invoice number is required.");
        }
        if (clientId == null) {
            errors.add("Client is required.");
        }
        if (items != null) {
            for (int i = 0; i < items.size(); i++) {
                errors.addAll(items.get(i).validationErrors(i + 1));
            }
        }
        return errors;
    }

    @JsonIgnore
    public boolean isValid() {
        return validationErrors().isEmpty();
    }
}
