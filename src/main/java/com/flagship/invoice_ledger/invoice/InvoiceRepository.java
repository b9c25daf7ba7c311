package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.eventsourcing.AggregateRepository;
import com.flagship.invoice_ledger.eventstore.EventStore;
import com.flagship.invoice_ledger.eventstore.ExpectedVersion;
import com.flagship.invoice_ledger.invoice.event.ExpenseProofFilesAdded;
import com.flagship.invoice_ledger.invoice.event.ExpenseProofFilesDeleted;
import com.flagship.invoice_ledger.invoice.event.ExpenseProofFilesModified;
import com.flagship.invoice_ledger.invoice.event.InvoiceCreated;
import com.flagship.invoice_ledger.invoice.event.InvoiceDeleted;
import com.flagship.invoice_ledger.invoice.event.InvoiceEvent;
import com.flagship.invoice_ledger.invoice.event.InvoiceItemsAdded;
import com.flagship.invoice_ledger.invoice.event.InvoiceItemsDeleted;
import com.flagship.invoice_ledger.invoice.event.InvoiceItemsModified;
import com.flagship.invoice_ledger.invoice.event.InvoiceStatusChanged;
import com.flagship.invoice_ledger.invoice.event.InvoiceUpdated;
import com.flagship.invoice_ledger.observability.EventStoreMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Persistence of invoices as event streams.
 *
 * Besides the full update, items and expense proof files can be changed one
 * batch at a time. Those batch operations append without a version check, so
 * they never conflict with each other.
 */
@Component
@Slf4j
public class InvoiceRepository extends AggregateRepository<Invoice, InvoiceEvent> {

    private final Clock clock;

    public InvoiceRepository(EventStore eventStore,
                             InvoiceProjection projection,
                             @Qualifier("eventStoreExecutor") Executor executor,
                             EventStoreMetrics metrics,
                             Clock clock) {
        super(eventStore, projection, executor, metrics);
        this.clock = clock;
    }

    /**
     * All live invoices ordered by invoice number.
     */
    public CompletableFuture<List<Invoice>> getAllInvoices() {
        return getAll();
    }

    public CompletableFuture<List<Invoice>> getInvoicesByClientId(UUID clientId) {
        requireId(clientId);
        return queryAsync(invoice -> clientId.equals(invoice.getClientId()));
    }

    /**
     * Moves a previously loaded invoice to a new status.
     *
     * @param paidDate used when the invoice becomes paid and has no paid date yet;
     *                 today when null
     * @param notes    replaces the payment notes unless blank
     * @return the stream version after the change
     */
    public CompletableFuture<Long> changeStatus(Invoice invoice, InvoiceStatus newStatus,
                                                LocalDate paidDate, String notes) {
        requireLoaded(invoice);
        if (newStatus == null) {
            throw new IllegalArgumentException("New status is required");
        }
        LocalDate effectivePaidDate = invoice.paidDateAfterStatusChange(newStatus, paidDate, LocalDate.now(clock));
        InvoiceStatusChanged event = new InvoiceStatusChanged(
                invoice.getId(), newStatus, invoice.getStatus(), effectivePaidDate, notes);
        log.info("Changing status of invoice {} from {} to {}", invoice.getInvoiceNumber(), invoice.getStatus(), newStatus);
        return appendEvents(invoice.getId(), ExpectedVersion.exactly(invoice.getVersion()), List.of(event));
    }

    public CompletableFuture<Long> markAsPaid(Invoice invoice, LocalDate paidDate, String notes) {
        return changeStatus(invoice, InvoiceStatus.PAID, paidDate, notes);
    }

    public CompletableFuture<Long> addInvoiceItems(UUID invoiceId, List<InvoiceItem> items) {
        requireId(invoiceId);
        requireNotEmpty(items, "Invoice items list");
        log.info("Adding {} item(s) to invoice {}", items.size(), invoiceId);
        return appendEvents(invoiceId, ExpectedVersion.any(), List.of(new InvoiceItemsAdded(invoiceId, items)));
    }

    public CompletableFuture<Long> modifyInvoiceItems(UUID invoiceId, List<InvoiceItem> items) {
        requireId(invoiceId);
        requireNotEmpty(items, "Invoice items list");
        log.info("Modifying {} item(s) of invoice {}", items.size(), invoiceId);
        return appendEvents(invoiceId, ExpectedVersion.any(), List.of(new InvoiceItemsModified(invoiceId, items)));
    }

    public CompletableFuture<Long> deleteInvoiceItems(UUID invoiceId, List<UUID> itemIds) {
        requireId(invoiceId);
        requireNotEmpty(itemIds, "Invoice item ids list");
        log.info("Deleting {} item(s) from invoice {}", itemIds.size(), invoiceId);
        return appendEvents(invoiceId, ExpectedVersion.any(), List.of(new InvoiceItemsDeleted(invoiceId, itemIds)));
    }

    public CompletableFuture<Long> addExpenseProofFiles(UUID invoiceId, List<ExpenseProofFile> files) {
        requireId(invoiceId);
        requireNotEmpty(files, "Expense proof files list");
        log.info("Adding {} expense proof file(s) to invoice {}", files.size(), invoiceId);
        return appendEvents(invoiceId, ExpectedVersion.any(), List.of(new ExpenseProofFilesAdded(invoiceId, files)));
    }

    public CompletableFuture<Long> modifyExpenseProofFiles(UUID invoiceId, List<ExpenseProofFile> files) {
        requireId(invoiceId);
        requireNotEmpty(files, "Expense proof files list");
        log.info("Modifying {} expense proof file(s) of invoice {}", files.size(), invoiceId);
        return appendEvents(invoiceId, ExpectedVersion.any(), List.of(new ExpenseProofFilesModified(invoiceId, files)));
    }

    public CompletableFuture<Long> deleteExpenseProofFiles(UUID invoiceId, List<UUID> fileIds) {
        requireId(invoiceId);
        requireNotEmpty(fileIds, "Expense proof file ids list");
        log.info("Deleting {} expense proof file(s) from invoice {}", fileIds.size(), invoiceId);
        return appendEvents(invoiceId, ExpectedVersion.any(), List.of(new ExpenseProofFilesDeleted(invoiceId, fileIds)));
    }

    @Override
    protected List<String> validate(Invoice invoice) {
        return invoice.validationErrors();
    }

    @Override
    protected InvoiceEvent createdEvent(Invoice invoice) {
        return InvoiceCreated.of(invoice);
    }

    @Override
    protected InvoiceEvent updatedEvent(Invoice invoice) {
        return InvoiceUpdated.of(invoice);
    }

    @Override
    protected InvoiceEvent deletedEvent(UUID id) {
        return new InvoiceDeleted(id);
    }

    @Override
    protected Comparator<Invoice> displayOrder() {
        return Comparator.comparing(Invoice::getInvoiceNumber, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Invoice::getId);
    }
}
