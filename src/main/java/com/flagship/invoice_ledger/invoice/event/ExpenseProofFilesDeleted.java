package com.flagship.invoice_ledger.invoice.event;

import java.util.List;
import java.util.UUID;

/**
 * Expense proof files were removed. Unknown ids are ignored.
 */
public record ExpenseProofFilesDeleted(UUID invoiceId, List<UUID> fileIds) implements InvoiceEvent {

    public ExpenseProofFilesDeleted {
        fileIds = List.copyOf(fileIds);
    }

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.EXPENSE_PROOF_FILES_DELETED;
    }
}
