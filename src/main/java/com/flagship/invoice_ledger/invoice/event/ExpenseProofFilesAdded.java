package com.flagship.invoice_ledger.invoice.event;

import com.flagship.invoice_ledger.invoice.ExpenseProofFile;

import java.util.List;
import java.util.UUID;

/**
 * Expense proof files were attached. Files whose id is already present are skipped.
 */
public record ExpenseProofFilesAdded(UUID invoiceId, List<ExpenseProofFile> files) implements InvoiceEvent {

    public ExpenseProofFilesAdded {
        files = List.copyOf(files);
    }

    @Override
    public InvoiceEventKind kind() {
        return InvoiceEventKind.EXPENSE_PROOF_FILES_ADDED;
    }
}
