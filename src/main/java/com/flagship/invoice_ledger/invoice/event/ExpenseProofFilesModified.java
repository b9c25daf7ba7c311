package com.flagship.invoice_ledger.invoice.event;

import com.flagship.invoice_ledger.invoice.ExpenseProofFile;

import java.util.List;
import java.util.UUID;

/**
 * Expense proof files were replaced by id. Unknown ids are appended.
 */
public record ExpenseProofFilesModified(UUID invoiceId, List<ExpenseProofFile> files) implements InvoiceEvent {

    public ExpenseProofFilesModified {
        files = List.copyOf(files);
    }

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.EXPENSE_PROOF_FILES_MODIFIED;
    }
}
